/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.apollo.ca.ext;

import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;

public class SubjectAltNameExtension extends CertExtension {

    public static SubjectAltNameExtension create(final GeneralName... names) {
        return new SubjectAltNameExtension(new GeneralNames(names));
    }

    public static SubjectAltNameExtension create(final NameType type, final String... names) {
        if (names.length == 0) {
            throw new IllegalArgumentException("At least one subject alternative name is required");
        }
        return new SubjectAltNameExtension(type.generalNames(names));
    }

    SubjectAltNameExtension(final GeneralNames names) {
        super(Extension.subjectAlternativeName, false, names);
    }
}
