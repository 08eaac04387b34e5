/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.apollo.ca;

import java.security.PrivateKey;
import java.security.Provider;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;

import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues certificates for certificate signing requests on behalf of a CA.
 * <p>
 * Issuance decodes the CA private key, the CA certificate and the request, in that order, verifies the request's
 * self-signature, assembles a version 3 certificate binding the request's subject and public key to the CA's
 * subject as issuer, and signs it with the CA key over SHA-256. The first failing stage aborts the issuance with
 * the corresponding {@link CaException}; nothing is returned unless every stage succeeded.
 * <p>
 * Instances hold no per-call state and may be shared between threads. Construction performs the one time
 * {@link CryptoProvider#initialize() provider registration}.
 */
public class CsrSigner {
    private static final Logger log = LoggerFactory.getLogger(CsrSigner.class);

    private final CertificateBuilder builder;
    private final PemDecoder         decoder;
    private final Provider           provider;
    private final CertificateSigner  signer;
    private final RequestVerifier    verifier;

    public CsrSigner() {
        this(SignerParameters.newBuilder().build());
    }

    public CsrSigner(SignerParameters parameters) {
        CryptoProvider.initialize();
        this.provider = CryptoProvider.getProviderBC();
        this.decoder = new PemDecoder(provider);
        this.verifier = new RequestVerifier(provider);
        this.builder = new CertificateBuilder(parameters);
        this.signer = new CertificateSigner(provider);
    }

    /**
     * Issue a certificate and return it as a Java certificate rather than PEM.
     */
    public X509Certificate issue(final byte[] privateKeyPem, final char[] passphrase, final byte[] caCertificatePem,
                                 final byte[] csrPem) {
        final X509CertificateHolder holder = issueCertificate(privateKeyPem, passphrase, caCertificatePem, csrPem);
        try {
            return new JcaX509CertificateConverter().setProvider(provider).getCertificate(holder);
        } catch (CertificateException e) {
            throw new EncodingException("Unable to convert certificate: " + holder.getSubject(), e);
        }
    }

    /**
     * Issue a certificate using an unencrypted CA private key.
     *
     * @return the PEM encoding of the signed certificate
     */
    public byte[] signCsr(final byte[] privateKeyPem, final byte[] caCertificatePem, final byte[] csrPem) {
        return signCsr(privateKeyPem, null, caCertificatePem, csrPem);
    }

    /**
     * Issue a certificate.
     *
     * @param privateKeyPem    - the CA private key, PEM encoded
     * @param passphrase       - unlocks an encrypted CA private key, null if the key is not encrypted
     * @param caCertificatePem - the CA certificate, PEM encoded
     * @param csrPem           - the certificate signing request, PEM encoded
     * @return the PEM encoding of the signed certificate
     * @throws DecodeException                 if any input is empty or cannot be decoded
     * @throws SignatureVerificationException if the request's signature does not verify
     * @throws BuildException                  if the certificate cannot be assembled
     * @throws SigningException                if the certificate cannot be signed with the CA key
     * @throws EncodingException               if the signed certificate cannot be encoded
     */
    public byte[] signCsr(final byte[] privateKeyPem, final char[] passphrase, final byte[] caCertificatePem,
                          final byte[] csrPem) {
        return signer.encode(issueCertificate(privateKeyPem, passphrase, caCertificatePem, csrPem));
    }

    private X509CertificateHolder issueCertificate(final byte[] privateKeyPem, final char[] passphrase,
                                                   final byte[] caCertificatePem, final byte[] csrPem) {
        final PrivateKey caKey;
        final X509CertificateHolder caCertificate;
        final PKCS10CertificationRequest request;
        try {
            caKey = decoder.decodePrivateKey(privateKeyPem, passphrase);
            caCertificate = decoder.decodeCertificate(caCertificatePem);
            request = decoder.decodeRequest(csrPem);
        } catch (DecodeException e) {
            log.warn("Rejecting issuance, {}", e.getMessage());
            throw e;
        }

        verifier.verify(request);

        final UnsignedCertificate unsigned = builder.build(caCertificate, request);
        final X509CertificateHolder certificate = signer.sign(unsigned, caKey, caCertificate);

        log.info("Issued certificate subject: {} issuer: {} serial: {} expires: {}", certificate.getSubject(),
                 certificate.getIssuer(), certificate.getSerialNumber(), unsigned.notAfter());
        return certificate;
    }
}
