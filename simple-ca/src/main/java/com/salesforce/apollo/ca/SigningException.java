/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.apollo.ca;

/**
 * The assembled certificate could not be signed with the CA key.
 */
public class SigningException extends CaException {
    private static final long serialVersionUID = 218125857L;

    public SigningException(String message) {
        super(Kind.SIGNING, message);
    }

    public SigningException(String message, Throwable cause) {
        super(Kind.SIGNING, message, cause);
    }
}
