/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.apollo.ca;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.security.Provider;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.openssl.PEMDecryptorProvider;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.X509TrustedCertificateBlock;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JceOpenSSLPKCS8DecryptorProviderBuilder;
import org.bouncycastle.openssl.jcajce.JcePEMDecryptorProviderBuilder;
import org.bouncycastle.operator.InputDecryptorProvider;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;
import org.bouncycastle.pkcs.PKCSException;

/**
 * Decodes the PEM inputs of a signing operation. Only the first PEM object of each buffer is considered; text
 * before its {@code -----BEGIN} line and anything after its {@code -----END} line is ignored.
 */
public class PemDecoder {
    private final Provider provider;

    public PemDecoder(Provider provider) {
        this.provider = provider;
    }

    /**
     * Decode a CA certificate. Both {@code CERTIFICATE} and OpenSSL {@code TRUSTED CERTIFICATE} blocks are
     * accepted.
     */
    public X509CertificateHolder decodeCertificate(final byte[] pem) {
        final Object parsed = readObject(pem, "CA certificate");
        if (parsed instanceof X509CertificateHolder) {
            return (X509CertificateHolder) parsed;
        }
        if (parsed instanceof X509TrustedCertificateBlock) {
            return ((X509TrustedCertificateBlock) parsed).getCertificateHolder();
        }
        throw new DecodeException("CA certificate: not an X.509 certificate, found " + describe(parsed));
    }

    /**
     * Decode a private key in traditional OpenSSL ({@code RSA PRIVATE KEY}, {@code EC PRIVATE KEY}, ...) or PKCS#8
     * form, either of which may be encrypted.
     *
     * @param pem        - the PEM encoded key
     * @param passphrase - the passphrase unlocking an encrypted key, may be null for plaintext keys
     * @return the decoded key
     */
    public PrivateKey decodePrivateKey(final byte[] pem, final char[] passphrase) {
        final Object parsed = readObject(pem, "private key");
        final JcaPEMKeyConverter converter = new JcaPEMKeyConverter().setProvider(provider);
        try {
            if (parsed instanceof PEMKeyPair) {
                return converter.getPrivateKey(((PEMKeyPair) parsed).getPrivateKeyInfo());
            }
            if (parsed instanceof PrivateKeyInfo) {
                return converter.getPrivateKey((PrivateKeyInfo) parsed);
            }
            if (parsed instanceof PEMEncryptedKeyPair) {
                final PEMDecryptorProvider decryptor = new JcePEMDecryptorProviderBuilder().setProvider(provider)
                                                                                           .build(requirePassphrase(passphrase));
                return converter.getPrivateKey(((PEMEncryptedKeyPair) parsed).decryptKeyPair(decryptor).getPrivateKeyInfo());
            }
            if (parsed instanceof PKCS8EncryptedPrivateKeyInfo) {
                final InputDecryptorProvider decryptor = new JceOpenSSLPKCS8DecryptorProviderBuilder().setProvider(provider)
                                                                                                      .build(requirePassphrase(passphrase));
                return converter.getPrivateKey(((PKCS8EncryptedPrivateKeyInfo) parsed).decryptPrivateKeyInfo(decryptor));
            }
        } catch (IOException | OperatorCreationException | PKCSException e) {
            throw new DecodeException("private key: unable to decode or decrypt key: " + e.getMessage(), e);
        }
        throw new DecodeException("private key: not a supported private key, found " + describe(parsed));
    }

    public PKCS10CertificationRequest decodeRequest(final byte[] pem) {
        final Object parsed = readObject(pem, "certificate request");
        if (parsed instanceof PKCS10CertificationRequest) {
            return (PKCS10CertificationRequest) parsed;
        }
        throw new DecodeException("certificate request: not a PKCS#10 certification request, found "
        + describe(parsed));
    }

    private String describe(Object parsed) {
        return parsed.getClass().getSimpleName();
    }

    private Object readObject(final byte[] pem, final String what) {
        if (pem == null || pem.length == 0) {
            throw new DecodeException(what + ": input is empty");
        }
        try (Reader reader = new InputStreamReader(new ByteArrayInputStream(pem), StandardCharsets.US_ASCII);
             PEMParser pemParser = new PEMParser(reader)) {
            final Object parsed = pemParser.readObject();
            if (parsed == null) {
                throw new DecodeException(what + ": no PEM object found");
            }
            return parsed;
        } catch (IOException | IllegalStateException | IllegalArgumentException e) {
            throw new DecodeException(what + ": malformed PEM: " + e.getMessage(), e);
        }
    }

    private char[] requirePassphrase(char[] passphrase) {
        if (passphrase == null) {
            throw new DecodeException("private key: key is encrypted and no passphrase was supplied");
        }
        return passphrase;
    }
}
