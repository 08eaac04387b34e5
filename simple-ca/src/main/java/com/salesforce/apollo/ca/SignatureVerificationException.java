/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.apollo.ca;

/**
 * The certificate request's self-signature does not verify against its own public key.
 */
public class SignatureVerificationException extends CaException {
    private static final long serialVersionUID = 174165569L;

    public SignatureVerificationException(String message) {
        super(Kind.SIGNATURE_VERIFICATION, message);
    }

    public SignatureVerificationException(String message, Throwable cause) {
        super(Kind.SIGNATURE_VERIFICATION, message, cause);
    }
}
