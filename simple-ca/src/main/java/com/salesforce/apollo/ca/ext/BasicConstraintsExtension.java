/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.apollo.ca.ext;

import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;

/**
 * Basic constraints, always marked critical
 */
public class BasicConstraintsExtension extends CertExtension {

    public static BasicConstraintsExtension ca(final int pathLength) {
        if (pathLength < 0) {
            throw new IllegalArgumentException("Path length must be >= 0: " + pathLength);
        }
        return new BasicConstraintsExtension(new BasicConstraints(pathLength));
    }

    public static BasicConstraintsExtension endEntity() {
        return new BasicConstraintsExtension(new BasicConstraints(false));
    }

    BasicConstraintsExtension(final BasicConstraints constraints) {
        super(Extension.basicConstraints, true, constraints);
    }
}
