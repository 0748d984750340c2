////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.pycoffee.config;

import java.util.Objects;

/**
 * Immutable settings for one renderer. Use {@link #defaults()} and the
 * {@code with*} methods to derive variants.
 */
public final class RendererOptions {

    public static final String DEFAULT_INDENT_UNIT = "    ";
    public static final String DEFAULT_RECEIVER_NAME = "self";
    public static final String DEFAULT_RECEIVER_SIGIL = "@";

    private static final RendererOptions DEFAULTS = new RendererOptions(
            DEFAULT_INDENT_UNIT, false, DEFAULT_RECEIVER_NAME, DEFAULT_RECEIVER_SIGIL);

    private final String indentUnit;
    private final boolean strictOperators;
    private final String receiverName;
    private final String receiverSigil;

    private RendererOptions(String indentUnit, boolean strictOperators, String receiverName, String receiverSigil) {
        this.indentUnit = Objects.requireNonNull(indentUnit, "indentUnit");
        this.strictOperators = strictOperators;
        this.receiverName = Objects.requireNonNull(receiverName, "receiverName");
        this.receiverSigil = Objects.requireNonNull(receiverSigil, "receiverSigil");
    }

    public static RendererOptions defaults() {
        return DEFAULTS;
    }

    /** Text repeated once per indent level in front of each emitted line. */
    public String getIndentUnit() {
        return indentUnit;
    }

    /**
     * When {@code true}, an operator without a spelling aborts the render;
     * otherwise it renders as {@code <KindName>}.
     */
    public boolean isStrictOperators() {
        return strictOperators;
    }

    public String getReceiverName() {
        return receiverName;
    }

    public String getReceiverSigil() {
        return receiverSigil;
    }

    public RendererOptions withIndentUnit(String value) {
        return new RendererOptions(value, strictOperators, receiverName, receiverSigil);
    }

    public RendererOptions withStrictOperators(boolean value) {
        return new RendererOptions(indentUnit, value, receiverName, receiverSigil);
    }

    public RendererOptions withReceiverName(String value) {
        return new RendererOptions(indentUnit, strictOperators, value, receiverSigil);
    }

    public RendererOptions withReceiverSigil(String value) {
        return new RendererOptions(indentUnit, strictOperators, receiverName, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RendererOptions)) {
            return false;
        }
        RendererOptions other = (RendererOptions) o;
        return strictOperators == other.strictOperators
                && indentUnit.equals(other.indentUnit)
                && receiverName.equals(other.receiverName)
                && receiverSigil.equals(other.receiverSigil);
    }

    @Override
    public int hashCode() {
        return Objects.hash(indentUnit, strictOperators, receiverName, receiverSigil);
    }

    @Override
    public String toString() {
        return "RendererOptions[indentUnit='" + indentUnit + "', strictOperators=" + strictOperators
                + ", receiverName=" + receiverName + ", receiverSigil=" + receiverSigil + "]";
    }
}
