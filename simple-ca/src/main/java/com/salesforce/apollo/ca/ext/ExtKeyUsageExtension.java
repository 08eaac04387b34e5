/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.apollo.ca.ext;

import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyPurposeId;

public class ExtKeyUsageExtension extends CertExtension {

    public static ExtKeyUsageExtension create(final KeyPurposeId... usages) {
        return new ExtKeyUsageExtension(new ExtendedKeyUsage(usages));
    }

    ExtKeyUsageExtension(final ExtendedKeyUsage extendedKeyUsage) {
        super(Extension.extendedKeyUsage, false, extendedKeyUsage);
    }
}
