/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.apollo.ca;

import java.math.BigInteger;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

import org.bouncycastle.asn1.x509.AuthorityKeyIdentifier;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.SubjectKeyIdentifier;
import org.bouncycastle.cert.CertIOException;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.salesforce.apollo.ca.ext.CertExtension;

/**
 * Assembles the unsigned X.509v3 certificate for a verified request: the subject and public key come from the
 * request, the issuer is the subject of the CA certificate.
 */
public class CertificateBuilder {
    private static final Logger log = LoggerFactory.getLogger(CertificateBuilder.class);

    private final SignerParameters parameters;

    public CertificateBuilder(SignerParameters parameters) {
        this.parameters = parameters;
    }

    public UnsignedCertificate build(final X509CertificateHolder issuer, final PKCS10CertificationRequest request) {
        final Duration validity = parameters.validity();
        if (validity == null || validity.isNegative() || validity.isZero()) {
            throw new BuildException("Validity must be positive: " + validity);
        }
        final BigInteger serialNumber = serialNumber();
        // X.509 times carry whole seconds only
        final Instant notBefore = parameters.clock().instant().truncatedTo(ChronoUnit.SECONDS);
        final Instant notAfter = notBefore.plus(validity);

        final X509v3CertificateBuilder certBuilder;
        try {
            certBuilder = new X509v3CertificateBuilder(issuer.getSubject(), serialNumber, Date.from(notBefore),
                                                       Date.from(notAfter), request.getSubject(),
                                                       request.getSubjectPublicKeyInfo());
        } catch (IllegalArgumentException e) {
            throw new BuildException("Unable to assemble certificate for: " + request.getSubject(), e);
        }

        try {
            if (parameters.authorityKeyIdentifier() || parameters.subjectKeyIdentifier()) {
                final JcaX509ExtensionUtils extUtils = new JcaX509ExtensionUtils();
                if (parameters.authorityKeyIdentifier()) {
                    certBuilder.addExtension(Extension.authorityKeyIdentifier, false,
                                             authorityKeyIdentifier(extUtils, issuer));
                }
                if (parameters.subjectKeyIdentifier()) {
                    certBuilder.addExtension(Extension.subjectKeyIdentifier, false,
                                             extUtils.createSubjectKeyIdentifier(request.getSubjectPublicKeyInfo()));
                }
            }
            for (final CertExtension e : parameters.extensions()) {
                certBuilder.addExtension(e.getOid(), e.isCritical(), e.getValue());
            }
        } catch (NoSuchAlgorithmException | CertIOException | IllegalArgumentException e) {
            throw new BuildException("Unable to add extensions to certificate for: " + request.getSubject(), e);
        }

        log.debug("Built certificate subject: {} issuer: {} serial: {} not before: {} not after: {}",
                  request.getSubject(), issuer.getSubject(), serialNumber, notBefore, notAfter);
        return new UnsignedCertificate(certBuilder, serialNumber, notBefore, notAfter);
    }

    /**
     * The CA's own subject key identifier when its certificate carries one, otherwise the SHA-1 hash of its key
     */
    private AuthorityKeyIdentifier authorityKeyIdentifier(final JcaX509ExtensionUtils extUtils,
                                                          final X509CertificateHolder issuer) {
        final Extension caKeyId = issuer.getExtension(Extension.subjectKeyIdentifier);
        if (caKeyId != null) {
            return new AuthorityKeyIdentifier(SubjectKeyIdentifier.getInstance(caKeyId.getParsedValue())
                                                                  .getKeyIdentifier());
        }
        return extUtils.createAuthorityKeyIdentifier(issuer.getSubjectPublicKeyInfo());
    }

    private BigInteger serialNumber() {
        final BigInteger serialNumber = parameters.serialNumberGenerator().nextSerialNumber();
        if (serialNumber == null) {
            throw new BuildException("Serial number generator returned null");
        }
        if (serialNumber.signum() < 0) {
            throw new BuildException("Serial number must not be negative: " + serialNumber);
        }
        if (serialNumber.bitLength() > SerialNumberGenerator.MAX_SERIAL_LENGTH) {
            throw new BuildException("Serial number exceeds 20 octets: " + serialNumber);
        }
        return serialNumber;
    }
}
