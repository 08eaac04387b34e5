/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.apollo.ca.ext;

import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;

/**
 * An X.509v3 extension to be placed in an issued certificate
 */
public class CertExtension {
    private final boolean              critical;
    private final ASN1ObjectIdentifier oid;
    private final ASN1Encodable        value;

    public CertExtension(final ASN1ObjectIdentifier oid, final boolean critical, final ASN1Encodable value) {
        this.oid = oid;
        this.critical = critical;
        this.value = value;
    }

    public ASN1ObjectIdentifier getOid() {
        return oid;
    }

    public ASN1Encodable getValue() {
        return value;
    }

    public boolean isCritical() {
        return critical;
    }

    @Override
    public String toString() {
        return "Extension [" + oid + (critical ? " critical" : "") + "=" + value + "]";
    }
}
