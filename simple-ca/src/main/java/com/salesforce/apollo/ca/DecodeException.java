/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.apollo.ca;

/**
 * The supplied PEM input could not be decoded into the expected object.
 */
public class DecodeException extends CaException {
    private static final long serialVersionUID = 226420842L;

    public DecodeException(String message) {
        super(Kind.DECODE, message);
    }

    public DecodeException(String message, Throwable cause) {
        super(Kind.DECODE, message, cause);
    }
}
