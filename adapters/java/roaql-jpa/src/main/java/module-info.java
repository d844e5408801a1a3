module io.github.cyfko.roaql.jpa {
    requires io.github.cyfko.roaql.core;
    requires jakarta.persistence;
    requires java.logging;

    exports io.github.cyfko.roaql.jpa;
    exports io.github.cyfko.roaql.jpa.utils;
}
