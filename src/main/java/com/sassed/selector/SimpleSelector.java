package com.sassed.selector;

public sealed interface SimpleSelector {
    String toCss();

    /**
     * A type selector, or the universal selector when {@code name} is {@code *}.
     */
    record Type(String name) implements SimpleSelector {
        public boolean isUniversal() {
            return name.equals("*") || name.endsWith("|*");
        }

        @Override
        public String toCss() {
            return name;
        }
    }

    record ClassName(String name) implements SimpleSelector {
        @Override
        public String toCss() {
            return "." + name;
        }
    }

    record Id(String name) implements SimpleSelector {
        @Override
        public String toCss() {
            return "#" + name;
        }
    }

    record Placeholder(String name) implements SimpleSelector {
        @Override
        public String toCss() {
            return "%" + name;
        }
    }

    /**
     * {@code text} is the bracketed body, e.g. {@code type="text"}.
     */
    record Attribute(String text) implements SimpleSelector {
        @Override
        public String toCss() {
            return "[" + text + "]";
        }
    }

    /**
     * {@code argument} is the raw text between the parentheses, or null.
     */
    record Pseudo(String name, String argument, boolean element) implements SimpleSelector {
        @Override
        public String toCss() {
            String prefix = element ? "::" : ":";
            return argument == null ? prefix + name : prefix + name + "(" + argument + ")";
        }
    }

    /**
     * The parent reference {@code &}, with an optional suffix as in {@code &-active}.
     */
    record Parent(String suffix) implements SimpleSelector {
        @Override
        public String toCss() {
            return "&" + suffix;
        }
    }
}
