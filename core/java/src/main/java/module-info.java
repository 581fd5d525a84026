module io.github.cyfko.drlparser.core {
    requires java.logging;

    exports io.github.cyfko.drlparser.core.api;
    exports io.github.cyfko.drlparser.core.cache;
    exports io.github.cyfko.drlparser.core.config;
    exports io.github.cyfko.drlparser.core.exception;
    exports io.github.cyfko.drlparser.core.impl;
    exports io.github.cyfko.drlparser.core.model;
    exports io.github.cyfko.drlparser.core.parsing;
    exports io.github.cyfko.drlparser.core.spi;
}
