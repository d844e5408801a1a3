module io.github.cyfko.roaql.core {
    requires com.fasterxml.jackson.databind;
    requires java.logging;

    exports io.github.cyfko.roaql.core.api;
    exports io.github.cyfko.roaql.core.config;
    exports io.github.cyfko.roaql.core.exception;
    exports io.github.cyfko.roaql.core.impl;
    exports io.github.cyfko.roaql.core.model;
    exports io.github.cyfko.roaql.core.parsing;
    exports io.github.cyfko.roaql.core.spi;
    exports io.github.cyfko.roaql.core.utils;
}
