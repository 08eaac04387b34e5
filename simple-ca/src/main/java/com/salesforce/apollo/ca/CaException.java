/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.apollo.ca;

/**
 * Root of the failures raised while issuing a certificate. Every failure carries the {@link Kind} of the stage
 * that rejected the request.
 */
public class CaException extends RuntimeException {

    public enum Kind {
        BUILD, DECODE, ENCODING, SIGNATURE_VERIFICATION, SIGNING;
    }

    private static final long serialVersionUID = -9188923051885159431L;

    private final Kind kind;

    public CaException(final Kind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public CaException(final Kind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + kind + "]: " + getMessage();
    }
}
