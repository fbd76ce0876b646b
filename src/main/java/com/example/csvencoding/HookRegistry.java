package com.example.csvencoding;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * Finds the encode and decode overrides of a type.
 * <p>
 * Detection is a two-phase query, first match wins for each direction:
 * <ol>
 *   <li>the type's own capabilities: {@link CsvGetter}/{@link CsvSetter}, then
 *   {@link TextMarshaler}/{@link TextUnmarshaler};</li>
 *   <li>text adapters registered for the type, for classes that cannot implement the
 *   interfaces themselves ({@code java.time}, {@code UUID}, ...).</li>
 * </ol>
 * Registries are immutable once built and cache their answers per class.
 */
@Slf4j
public final class HookRegistry {

    /** Produces the cells of a non-null value. */
    @FunctionalInterface
    public interface EncodeHook {
        List<String> encode(Object value) throws Exception;
    }

    /** Produces the value a single cell stands for. */
    @FunctionalInterface
    public interface DecodeHook {
        Object decode(Class<?> type, String cell) throws Exception;
    }

    /** Parses the text form of a registered type. */
    @FunctionalInterface
    public interface TextParser<T> {
        T parse(String text) throws Exception;
    }

    @Value
    public static class Hooks {
        public static final Hooks NONE = new Hooks(null, null);

        EncodeHook encodeHook;
        DecodeHook decodeHook;

        public boolean isEmpty() {
            return encodeHook == null && decodeHook == null;
        }
    }

    private static final EncodeHook CELL_GETTER = value -> ((CsvGetter) value).getCells();
    private static final EncodeHook TEXT_MARSHALER = value -> Collections.singletonList(((TextMarshaler) value).toText());

    private static final DecodeHook CELL_SETTER = (type, cell) -> {
        CsvSetter setter = (CsvSetter) Instantiation.newInstance(type);
        setter.setCells(Collections.singletonList(cell));
        return setter;
    };
    private static final DecodeHook TEXT_UNMARSHALER = (type, cell) -> {
        TextUnmarshaler unmarshaler = (TextUnmarshaler) Instantiation.newInstance(type);
        unmarshaler.fromText(cell);
        return unmarshaler;
    };

    private static final HookRegistry DEFAULTS = builder()
            .text(Instant.class, Instant::toString, Instant::parse)
            .text(LocalDate.class, LocalDate::toString, LocalDate::parse)
            .text(LocalTime.class, LocalTime::toString, LocalTime::parse)
            .text(LocalDateTime.class, LocalDateTime::toString, LocalDateTime::parse)
            .text(OffsetDateTime.class, OffsetDateTime::toString, OffsetDateTime::parse)
            .text(ZonedDateTime.class, ZonedDateTime::toString, ZonedDateTime::parse)
            .text(Duration.class, Duration::toString, Duration::parse)
            .text(UUID.class, UUID::toString, UUID::fromString)
            .text(BigDecimal.class, BigDecimal::toPlainString, BigDecimal::new)
            .text(BigInteger.class, BigInteger::toString, BigInteger::new)
            .build();

    private final Map<Class<?>, Hooks> adapters;
    private final ClassValue<Hooks> detected = new ClassValue<Hooks>() {
        @Override
        protected Hooks computeValue(Class<?> type) {
            return detect(type);
        }
    };

    private HookRegistry(Map<Class<?>, Hooks> adapters) {
        this.adapters = Collections.unmodifiableMap(new LinkedHashMap<>(adapters));
    }

    /**
     * Registry with text adapters for the {@code java.time} types, {@code UUID},
     * {@code BigDecimal} and {@code BigInteger}.
     */
    public static HookRegistry defaults() {
        return DEFAULTS;
    }

    /**
     * Empty builder: only the types' own capabilities are detected.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder seeded with this registry's adapters.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.adapters.putAll(adapters);
        return builder;
    }

    public Hooks detectHooks(Class<?> type) {
        return detected.get(type);
    }

    private Hooks detect(Class<?> type) {
        EncodeHook encode = null;
        DecodeHook decode = null;
        if (CsvGetter.class.isAssignableFrom(type)) {
            encode = CELL_GETTER;
        } else if (TextMarshaler.class.isAssignableFrom(type)) {
            encode = TEXT_MARSHALER;
        }
        if (CsvSetter.class.isAssignableFrom(type)) {
            decode = CELL_SETTER;
        } else if (TextUnmarshaler.class.isAssignableFrom(type)) {
            decode = TEXT_UNMARSHALER;
        }

        if (encode == null || decode == null) {
            Hooks adapter = findAdapter(type);
            if (adapter != null) {
                encode = encode == null ? adapter.getEncodeHook() : encode;
                decode = decode == null ? adapter.getDecodeHook() : decode;
            }
        }
        if (encode == null && decode == null) {
            return Hooks.NONE;
        }
        log.debug("Hooks for {}: encode={}, decode={}", type.getName(), encode != null, decode != null);
        return new Hooks(encode, decode);
    }

    private Hooks findAdapter(Class<?> type) {
        Hooks exact = adapters.get(type);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<Class<?>, Hooks> entry : adapters.entrySet()) {
            if (entry.getKey().isAssignableFrom(type)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public static final class Builder {
        private final Map<Class<?>, Hooks> adapters = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers a single-cell text form for {@code type}, replacing any earlier
         * registration for the same class.
         */
        public <T> Builder text(Class<T> type, Function<? super T, String> toText, TextParser<? extends T> fromText) {
            EncodeHook encode = value -> Collections.singletonList(toText.apply(type.cast(value)));
            DecodeHook decode = (target, cell) -> fromText.parse(cell);
            adapters.put(type, new Hooks(encode, decode));
            return this;
        }

        public HookRegistry build() {
            return new HookRegistry(adapters);
        }
    }
}
