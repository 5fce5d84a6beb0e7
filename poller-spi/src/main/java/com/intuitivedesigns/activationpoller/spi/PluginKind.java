/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.spi;

public enum PluginKind {
    SINK,
    CODEC
}
