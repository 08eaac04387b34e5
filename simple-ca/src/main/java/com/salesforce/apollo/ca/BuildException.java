/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.apollo.ca;

/**
 * A field of the certificate under construction was rejected.
 */
public class BuildException extends CaException {
    private static final long serialVersionUID = 68798185L;

    public BuildException(String message) {
        super(Kind.BUILD, message);
    }

    public BuildException(String message, Throwable cause) {
        super(Kind.BUILD, message, cause);
    }
}
