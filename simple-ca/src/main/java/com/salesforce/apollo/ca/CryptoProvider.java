/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.apollo.ca;

import java.security.Provider;
import java.security.Security;
import java.util.concurrent.atomic.AtomicBoolean;

import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process wide registration of the Bouncy Castle JCE provider. {@link #initialize()} may be called any number of
 * times from any thread; the provider is installed exactly once and every caller returns only after it is
 * available.
 */
public final class CryptoProvider {

    static final String PROVIDER_NAME_BC = BouncyCastleProvider.PROVIDER_NAME;

    private static final AtomicBoolean initialized = new AtomicBoolean(false);
    private static final Logger        log         = LoggerFactory.getLogger(CryptoProvider.class);
    private static volatile Provider   PROVIDER_BC;

    public static Provider getProviderBC() {
        if (!initialized.get()) {
            throw new IllegalStateException("Provider has not been initialized");
        }
        return PROVIDER_BC;
    }

    public static void initialize() {
        if (initialized.get()) {
            return;
        }
        synchronized (CryptoProvider.class) {
            if (initialized.get()) {
                return;
            }
            Provider bc = Security.getProvider(PROVIDER_NAME_BC);
            if (bc == null) {
                bc = new BouncyCastleProvider();
                Security.addProvider(bc);
                log.info("Registered JCE provider: {}", bc.getInfo());
            } else {
                log.debug("JCE provider already registered: {}", bc.getInfo());
            }
            PROVIDER_BC = bc;
            initialized.set(true);
        }
    }

    public static boolean isInitialized() {
        return initialized.get();
    }

    private CryptoProvider() {
    }
}
