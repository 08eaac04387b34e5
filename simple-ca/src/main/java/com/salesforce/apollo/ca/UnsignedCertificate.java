/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.apollo.ca;

import java.math.BigInteger;
import java.time.Instant;

import org.bouncycastle.cert.X509v3CertificateBuilder;

/**
 * The to-be-signed certificate with the values chosen for it
 */
public record UnsignedCertificate(X509v3CertificateBuilder builder, BigInteger serialNumber, Instant notBefore,
                                  Instant notAfter) {
}
