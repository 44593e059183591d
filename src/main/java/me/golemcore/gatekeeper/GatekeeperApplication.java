package me.golemcore.gatekeeper;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for Gatekeeper.
 *
 * <p>
 * Gatekeeper guards a single-admin dashboard API. It authenticates the admin
 * (password plus optional TOTP), issues short-lived signed session tokens, and
 * slows down or blocks abusive clients.
 *
 * <h2>Request flow</h2>
 *
 * <pre>
 * Login          → Blocklist → Attempt tracker → Password → TOTP → Token
 * Admin request  → Blocklist → Bearer token verification → Controller
 * Any request    → Per-source rate limit rules
 * </pre>
 *
 * <p>
 * Every security decision is recorded as a security event in the workspace
 * (see {@code gatekeeper.storage.*}).
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code gatekeeper.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class GatekeeperApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatekeeperApplication.class, args);
    }

}
