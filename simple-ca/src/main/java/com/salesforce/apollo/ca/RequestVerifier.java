/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.apollo.ca;

import java.security.Provider;
import java.security.PublicKey;

import org.bouncycastle.openssl.PEMException;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.operator.ContentVerifierProvider;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.RuntimeOperatorException;
import org.bouncycastle.operator.jcajce.JcaContentVerifierProviderBuilder;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.bouncycastle.pkcs.PKCSException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Proof of possession check for a certificate request: the request must be signed by the private key matching
 * the public key it carries.
 */
public class RequestVerifier {
    private static final Logger log = LoggerFactory.getLogger(RequestVerifier.class);

    private final Provider provider;

    public RequestVerifier(Provider provider) {
        this.provider = provider;
    }

    public void verify(final PKCS10CertificationRequest request) {
        final PublicKey publicKey;
        try {
            publicKey = new JcaPEMKeyConverter().setProvider(provider)
                                                .getPublicKey(request.getSubjectPublicKeyInfo());
        } catch (PEMException e) {
            throw new SignatureVerificationException("Unable to read public key of request: " + request.getSubject(),
                                                     e);
        }

        final boolean valid;
        try {
            final ContentVerifierProvider verifier = new JcaContentVerifierProviderBuilder().setProvider(provider)
                                                                                            .build(publicKey);
            valid = request.isSignatureValid(verifier);
        } catch (OperatorCreationException | PKCSException | RuntimeOperatorException e) {
            throw new SignatureVerificationException("Unable to verify signature on request: "
            + request.getSubject(), e);
        }
        if (!valid) {
            log.warn("Rejecting request with invalid signature, subject: {}", request.getSubject());
            throw new SignatureVerificationException("Invalid signature on request: " + request.getSubject());
        }
        log.debug("Verified request signature, subject: {} algorithm: {}", request.getSubject(),
                  request.getSignatureAlgorithm().getAlgorithm());
    }
}
