/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.apollo.ca.ext;

import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;

public enum NameType {
    DIRECTORY_NAME(GeneralName.directoryName), DNS_NAME(GeneralName.dNSName), IP_ADDRESS(GeneralName.iPAddress),
    REGISTERED_ID(GeneralName.registeredID), RFC_822_NAME(GeneralName.rfc822Name),
    /**
     * URI : Uniform Resource Identifier
     */
    URI(GeneralName.uniformResourceIdentifier);

    private final int tag;

    private NameType(final int tag) {
        this.tag = tag;
    }

    public GeneralName generalName(final String name) {
        return new GeneralName(tag, name);
    }

    public GeneralNames generalNames(final String... names) {
        final GeneralName[] generalNames = new GeneralName[names.length];
        for (int i = 0; i < names.length; i++) {
            generalNames[i] = generalName(names[i]);
        }
        return new GeneralNames(generalNames);
    }
}
