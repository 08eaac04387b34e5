/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.apollo.ca;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Source of certificate serial numbers. A serial number must be unique per issuing CA; the random generator is
 * the default.
 */
@FunctionalInterface
public interface SerialNumberGenerator {
    int DEFAULT_SERIAL_LENGTH = 128;

    /**
     * RFC 5280 limits serial numbers to 20 octets, and DER needs one of them for the sign.
     */
    int MAX_SERIAL_LENGTH = 159;

    /**
     * Always the same serial number. Only suitable for tests and for reproducing legacy issuance.
     */
    static SerialNumberGenerator constant(final BigInteger serialNumber) {
        return () -> serialNumber;
    }

    static SerialNumberGenerator random() {
        return random(new SecureRandom(), DEFAULT_SERIAL_LENGTH);
    }

    /**
     * Random, strictly positive serial numbers of at most <code>length</code> bits
     */
    static SerialNumberGenerator random(final SecureRandom entropy, final int length) {
        if (length < 1 || length > MAX_SERIAL_LENGTH) {
            throw new IllegalArgumentException("Serial length must be in [1, " + MAX_SERIAL_LENGTH + "]: " + length);
        }
        return () -> {
            BigInteger serial;
            do {
                serial = new BigInteger(length, entropy);
            } while (serial.signum() == 0);
            return serial;
        };
    }

    /**
     * Monotonically increasing serial numbers starting at <code>first</code>. The sequence lives in memory only.
     */
    static SerialNumberGenerator sequential(final BigInteger first) {
        final AtomicReference<BigInteger> next = new AtomicReference<>(first);
        return () -> next.getAndUpdate(current -> current.add(BigInteger.ONE));
    }

    BigInteger nextSerialNumber();
}
