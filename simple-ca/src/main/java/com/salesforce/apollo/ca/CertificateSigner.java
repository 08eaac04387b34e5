/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.apollo.ca;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.security.Provider;
import java.security.cert.CertificateException;

import org.bouncycastle.cert.CertException;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.RuntimeOperatorException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.operator.jcajce.JcaContentVerifierProviderBuilder;

/**
 * Signs assembled certificates with the CA key, always over a SHA-256 digest, and renders them as PEM.
 */
public class CertificateSigner {
    public static final String DIGEST_ALGORITHM = "SHA256";

    /**
     * @return the JCA signature algorithm pairing SHA-256 with the key's algorithm
     */
    static String signatureAlgorithm(final PrivateKey key) {
        switch (key.getAlgorithm()) {
        case "RSA":
            return DIGEST_ALGORITHM + "withRSA";
        case "EC":
        case "ECDSA":
            return DIGEST_ALGORITHM + "withECDSA";
        case "DSA":
            return DIGEST_ALGORITHM + "withDSA";
        default:
            throw new SigningException("Unsupported CA key algorithm: " + key.getAlgorithm());
        }
    }

    private final Provider provider;

    public CertificateSigner(Provider provider) {
        this.provider = provider;
    }

    public byte[] encode(final X509CertificateHolder certificate) {
        final StringWriter sw = new StringWriter();
        try {
            try (JcaPEMWriter writer = new JcaPEMWriter(sw)) {
                writer.writeObject(certificate);
                writer.flush();
            }
        } catch (final IOException e) {
            throw new EncodingException("Unable to encode certificate: " + certificate.getSubject(), e);
        }
        return sw.toString().getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Sign the certificate and check the result against the CA certificate's public key, which fails when the
     * supplied private key does not belong to the CA certificate.
     */
    public X509CertificateHolder sign(final UnsignedCertificate unsigned, final PrivateKey caKey,
                                      final X509CertificateHolder caCertificate) {
        final X509CertificateHolder holder;
        try {
            final ContentSigner sigGen = new JcaContentSignerBuilder(signatureAlgorithm(caKey)).setProvider(provider)
                                                                                              .build(caKey);
            holder = unsigned.builder().build(sigGen);
        } catch (OperatorCreationException | RuntimeOperatorException | IllegalStateException e) {
            throw new SigningException("Unable to sign certificate with " + caKey.getAlgorithm() + " key", e);
        }

        final boolean valid;
        try {
            valid = holder.isSignatureValid(new JcaContentVerifierProviderBuilder().setProvider(provider)
                                                                                   .build(caCertificate));
        } catch (OperatorCreationException | CertificateException | CertException | RuntimeOperatorException e) {
            throw new SigningException("Unable to verify signed certificate against CA certificate", e);
        }
        if (!valid) {
            throw new SigningException("Private key does not match CA certificate: " + caCertificate.getSubject());
        }
        return holder;
    }
}
