/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.apollo.ca;

/**
 * The signed certificate could not be serialized.
 */
public class EncodingException extends CaException {
    private static final long serialVersionUID = 141909009L;

    public EncodingException(String message) {
        super(Kind.ENCODING, message);
    }

    public EncodingException(String message, Throwable cause) {
        super(Kind.ENCODING, message, cause);
    }
}
