/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.apollo.ca;

import static com.salesforce.apollo.ca.TestPki.CA_NAME;
import static com.salesforce.apollo.ca.TestPki.LEAF_NAME;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import org.bouncycastle.asn1.x509.AuthorityKeyIdentifier;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.SubjectKeyIdentifier;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.salesforce.apollo.ca.ext.BasicConstraintsExtension;
import com.salesforce.apollo.ca.ext.ExtKeyUsageExtension;
import com.salesforce.apollo.ca.ext.KeyUsageExtension;
import com.salesforce.apollo.ca.ext.KeyUsageExtension.KeyUsage;
import com.salesforce.apollo.ca.ext.NameType;
import com.salesforce.apollo.ca.ext.SubjectAltNameExtension;

public class CertificateBuilderTest {

    private static final Instant NOW = Instant.parse("2026-06-30T23:59:59.999Z");

    private static X509CertificateHolder      caCertificate;
    private static PKCS10CertificationRequest request;
    private static CertificateSigner          signer;

    @BeforeAll
    public static void beforeClass() {
        CryptoProvider.initialize();
        caCertificate = TestPki.selfSigned(TestPki.caKeys(), CA_NAME);
        request = TestPki.csr(TestPki.leafKeys(), LEAF_NAME);
        signer = new CertificateSigner(CryptoProvider.getProviderBC());
    }

    private static SignerParameters.Builder parameters() {
        return SignerParameters.newBuilder().setClock(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    public void authorityKeyIdentifierFromCaCertificate() throws Exception {
        final SubjectKeyIdentifier truncated = new JcaX509ExtensionUtils().createTruncatedSubjectKeyIdentifier(caCertificate.getSubjectPublicKeyInfo());
        final X509CertificateHolder ca = TestPki.selfSigned(TestPki.caKeys(), CA_NAME, truncated);

        final UnsignedCertificate unsigned = new CertificateBuilder(parameters().setAuthorityKeyIdentifier(true)
                                                                                .build()).build(ca, request);
        final X509CertificateHolder certificate = signer.sign(unsigned, TestPki.caKeys().getPrivate(), ca);

        final byte[] keyId = AuthorityKeyIdentifier.fromExtensions(certificate.getExtensions()).getKeyIdentifier();
        assertEquals(8, keyId.length);
        assertArrayEquals(truncated.getKeyIdentifier(), keyId);
    }

    @Test
    public void duplicateExtensionRejected() {
        final CertificateBuilder builder = new CertificateBuilder(parameters().addExtension(KeyUsageExtension.create(KeyUsage.DIGITAL_SIGNATURE))
                                                                              .addExtension(KeyUsageExtension.create(KeyUsage.KEY_ENCIPHERMENT))
                                                                              .build());
        assertThrows(BuildException.class, () -> builder.build(caCertificate, request));
    }

    @Test
    public void extensions() {
        final UnsignedCertificate unsigned = new CertificateBuilder(parameters().addExtension(BasicConstraintsExtension.endEntity())
                                                                                .addExtension(KeyUsageExtension.create(KeyUsage.DIGITAL_SIGNATURE,
                                                                                                                       KeyUsage.KEY_ENCIPHERMENT))
                                                                                .addExtension(ExtKeyUsageExtension.create(KeyPurposeId.id_kp_serverAuth))
                                                                                .addExtension(SubjectAltNameExtension.create(NameType.DNS_NAME,
                                                                                                                             "test.com",
                                                                                                                             "www.test.com"))
                                                                                .build()).build(caCertificate,
                                                                                                request);
        final X509CertificateHolder certificate = sign(unsigned);

        final Extension basicConstraints = certificate.getExtension(Extension.basicConstraints);
        assertNotNull(basicConstraints);
        assertTrue(basicConstraints.isCritical());
        assertFalse(BasicConstraints.getInstance(basicConstraints.getParsedValue()).isCA());
        assertTrue(certificate.getExtension(Extension.keyUsage).isCritical());
        assertNotNull(certificate.getExtension(Extension.extendedKeyUsage));
        assertNotNull(certificate.getExtension(Extension.subjectAlternativeName));
        assertEquals(4, certificate.getExtensionOIDs().size());
    }

    @Test
    public void fields() {
        final UnsignedCertificate unsigned = new CertificateBuilder(parameters().setSerialNumberGenerator(SerialNumberGenerator.constant(BigInteger.valueOf(42)))
                                                                                .build()).build(caCertificate,
                                                                                                request);
        assertEquals(BigInteger.valueOf(42), unsigned.serialNumber());
        assertEquals(Instant.parse("2026-06-30T23:59:59Z"), unsigned.notBefore());
        assertEquals(Instant.parse("2027-06-30T23:59:59Z"), unsigned.notAfter());

        final X509CertificateHolder certificate = sign(unsigned);
        assertEquals(3, certificate.getVersionNumber());
        assertEquals(BigInteger.valueOf(42), certificate.getSerialNumber());
        assertEquals(CA_NAME, certificate.getIssuer());
        assertEquals(LEAF_NAME, certificate.getSubject());
        assertEquals(request.getSubjectPublicKeyInfo(), certificate.getSubjectPublicKeyInfo());
        assertEquals(unsigned.notBefore(), certificate.getNotBefore().toInstant());
        assertEquals(unsigned.notAfter(), certificate.getNotAfter().toInstant());
        assertFalse(certificate.hasExtensions());
    }

    @Test
    public void invalidSerialNumbers() {
        for (SerialNumberGenerator generator : new SerialNumberGenerator[] { () -> null,
                                                                             SerialNumberGenerator.constant(BigInteger.valueOf(-1)),
                                                                             SerialNumberGenerator.constant(BigInteger.ONE.shiftLeft(SerialNumberGenerator.MAX_SERIAL_LENGTH)) }) {
            final CertificateBuilder builder = new CertificateBuilder(parameters().setSerialNumberGenerator(generator)
                                                                                  .build());
            final BuildException e = assertThrows(BuildException.class, () -> builder.build(caCertificate, request));
            assertEquals(CaException.Kind.BUILD, e.getKind());
        }
    }

    @Test
    public void invalidValidity() {
        for (Duration validity : new Duration[] { Duration.ZERO, Duration.ofSeconds(-1), null }) {
            final CertificateBuilder builder = new CertificateBuilder(parameters().setValidity(validity).build());
            assertThrows(BuildException.class, () -> builder.build(caCertificate, request));
        }
    }

    @Test
    public void invalidValidityKeepsSerialNumber() {
        final SerialNumberGenerator serials = SerialNumberGenerator.sequential(BigInteger.TEN);
        final CertificateBuilder rejecting = new CertificateBuilder(parameters().setSerialNumberGenerator(serials)
                                                                                .setValidity(Duration.ZERO)
                                                                                .build());
        assertThrows(BuildException.class, () -> rejecting.build(caCertificate, request));
        assertThrows(BuildException.class, () -> rejecting.build(caCertificate, request));

        final UnsignedCertificate unsigned = new CertificateBuilder(parameters().setSerialNumberGenerator(serials)
                                                                                .build()).build(caCertificate,
                                                                                                request);
        assertEquals(BigInteger.TEN, unsigned.serialNumber());
    }

    @Test
    public void keyIdentifiers() throws Exception {
        final UnsignedCertificate unsigned = new CertificateBuilder(parameters().setAuthorityKeyIdentifier(true)
                                                                                .setSubjectKeyIdentifier(true)
                                                                                .build()).build(caCertificate,
                                                                                                request);
        final X509CertificateHolder certificate = sign(unsigned);
        final JcaX509ExtensionUtils utils = new JcaX509ExtensionUtils();

        assertEquals(utils.createAuthorityKeyIdentifier(caCertificate.getSubjectPublicKeyInfo()),
                     AuthorityKeyIdentifier.fromExtensions(certificate.getExtensions()));
        assertEquals(utils.createSubjectKeyIdentifier(request.getSubjectPublicKeyInfo()),
                     SubjectKeyIdentifier.fromExtensions(certificate.getExtensions()));
    }

    private X509CertificateHolder sign(UnsignedCertificate unsigned) {
        return signer.sign(unsigned, TestPki.caKeys().getPrivate(), caCertificate);
    }
}
