package com.iksanov.respcache.common.resp;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Reply value produced by command dispatch and consumed once by the encoder.
 * <p>
 * Variants:
 *  - {@link Simple}  {@code +text\r\n}
 *  - {@link Bulk}    {@code $len\r\nbytes\r\n}
 *  - {@link Null}    {@code $-1\r\n}
 *  - {@link Array}   {@code *n\r\n} followed by each item
 *  - {@link Error}   {@code -text\r\n}
 */
public sealed interface Reply permits Reply.Simple, Reply.Bulk, Reply.Null, Reply.Array, Reply.Error {

    Simple OK = new Simple("OK");
    Simple PONG = new Simple("PONG");
    Null NULL = new Null();

    static Bulk bulk(byte[] bytes) {
        return new Bulk(bytes);
    }

    static Bulk bulk(String text) {
        return new Bulk(text.getBytes(StandardCharsets.UTF_8));
    }

    static Array array(List<Reply> items) {
        return new Array(items);
    }

    static Array emptyArray() {
        return new Array(List.of());
    }

    static Error error(String message) {
        return new Error(message);
    }

    record Simple(String text) implements Reply {
        public Simple {
            Objects.requireNonNull(text, "text");
        }
    }

    record Bulk(byte[] bytes) implements Reply {
        public Bulk {
            Objects.requireNonNull(bytes, "bytes");
        }

        public String asString() {
            return new String(bytes, StandardCharsets.UTF_8);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bulk other && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return "Bulk[" + asString() + "]";
        }
    }

    record Null() implements Reply {
    }

    record Array(List<Reply> items) implements Reply {
        public Array {
            items = List.copyOf(items);
        }
    }

    record Error(String message) implements Reply {
        public Error {
            Objects.requireNonNull(message, "message");
        }
    }
}
