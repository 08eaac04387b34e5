/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.apollo.ca;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.salesforce.apollo.ca.ext.CertExtension;

/**
 * Issuance policy applied to every certificate a {@link CsrSigner} mints.
 */
public record SignerParameters(Duration validity, SerialNumberGenerator serialNumberGenerator, Clock clock,
                               List<CertExtension> extensions, boolean authorityKeyIdentifier,
                               boolean subjectKeyIdentifier) {

    /**
     * 365 days of wall clock time, independent of calendar leap rules
     */
    public static final Duration DEFAULT_VALIDITY = Duration.ofSeconds(31_536_000);

    public SignerParameters {
        Objects.requireNonNull(serialNumberGenerator, "serialNumberGenerator");
        Objects.requireNonNull(clock, "clock");
        extensions = List.copyOf(extensions);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        /**
         * Add the authority key identifier of the CA certificate's public key
         */
        private boolean                   authorityKeyIdentifier = false;
        private Clock                     clock                  = Clock.systemUTC();
        /**
         * Additional extensions, none by default
         */
        private final List<CertExtension> extensions             = new ArrayList<>();
        private SerialNumberGenerator     serialNumberGenerator  = SerialNumberGenerator.random();
        /**
         * Add the subject key identifier of the request's public key
         */
        private boolean                   subjectKeyIdentifier   = false;
        private Duration                  validity               = DEFAULT_VALIDITY;

        public Builder addExtension(CertExtension extension) {
            extensions.add(extension);
            return this;
        }

        public SignerParameters build() {
            return new SignerParameters(validity, serialNumberGenerator, clock, extensions, authorityKeyIdentifier,
                                        subjectKeyIdentifier);
        }

        public Clock getClock() {
            return clock;
        }

        public List<CertExtension> getExtensions() {
            return extensions;
        }

        public SerialNumberGenerator getSerialNumberGenerator() {
            return serialNumberGenerator;
        }

        public Duration getValidity() {
            return validity;
        }

        public boolean isAuthorityKeyIdentifier() {
            return authorityKeyIdentifier;
        }

        public boolean isSubjectKeyIdentifier() {
            return subjectKeyIdentifier;
        }

        public Builder setAuthorityKeyIdentifier(boolean authorityKeyIdentifier) {
            this.authorityKeyIdentifier = authorityKeyIdentifier;
            return this;
        }

        public Builder setClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder setSerialNumberGenerator(SerialNumberGenerator serialNumberGenerator) {
            this.serialNumberGenerator = serialNumberGenerator;
            return this;
        }

        public Builder setSubjectKeyIdentifier(boolean subjectKeyIdentifier) {
            this.subjectKeyIdentifier = subjectKeyIdentifier;
            return this;
        }

        public Builder setValidity(Duration validity) {
            this.validity = validity;
            return this;
        }
    }
}
