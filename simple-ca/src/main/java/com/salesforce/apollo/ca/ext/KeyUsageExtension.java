/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.apollo.ca.ext;

import org.bouncycastle.asn1.x509.Extension;

/**
 * Key usage, marked critical as RFC 5280 recommends
 */
public class KeyUsageExtension extends CertExtension {

    public static enum KeyUsage {
        CRL_SIGN(org.bouncycastle.asn1.x509.KeyUsage.cRLSign),
        DATA_ENCIPHERMENT(org.bouncycastle.asn1.x509.KeyUsage.dataEncipherment),
        DECIPHER_ONLY(org.bouncycastle.asn1.x509.KeyUsage.decipherOnly),
        DIGITAL_SIGNATURE(org.bouncycastle.asn1.x509.KeyUsage.digitalSignature),
        ENCIPHER_ONLY(org.bouncycastle.asn1.x509.KeyUsage.encipherOnly),
        KEY_AGREEMENT(org.bouncycastle.asn1.x509.KeyUsage.keyAgreement),
        KEY_CERT_SIGN(org.bouncycastle.asn1.x509.KeyUsage.keyCertSign),
        KEY_ENCIPHERMENT(org.bouncycastle.asn1.x509.KeyUsage.keyEncipherment),
        NON_REPUDIATION(org.bouncycastle.asn1.x509.KeyUsage.nonRepudiation);

        private final int keyUsage;

        private KeyUsage(final int keyUsage) {
            this.keyUsage = keyUsage;
        }
    }

    public static KeyUsageExtension create(final KeyUsage... usages) {
        if (usages.length == 0) {
            throw new IllegalArgumentException("At least one key usage is required");
        }
        int bits = 0;
        for (final KeyUsage ku : usages) {
            bits |= ku.keyUsage;
        }
        return new KeyUsageExtension(bits);
    }

    KeyUsageExtension(final int keyUsages) {
        super(Extension.keyUsage, true, new org.bouncycastle.asn1.x509.KeyUsage(keyUsages));
    }
}
