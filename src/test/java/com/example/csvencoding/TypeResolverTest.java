package com.example.csvencoding;

import com.example.csvencoding.exception.UnsupportedTypeException;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class TypeResolverTest {

    private final TypeResolver types = new TypeResolver(HookRegistry.defaults(), new FieldResolver());

    static class Kinds {
        int primitive;
        Long boxed;
        boolean flag;
        float ratio;
        String text;
        Thread.State state;
        Optional<String> maybe;
        List<String> list;
        String[] array;
        Set<Integer> set;
        Map<String, Integer> map;
        Object anything;
        Runnable callback;
        char letter;
        StringBuilder builder;
        Kinds self;
    }

    static class Address {
        String city;
        String zip;
    }

    static class Customer {
        String name;
        Address home;
        Optional<Address> work;
        @CsvField(embedded = true)
        Address mailing;
        LocalDate since;
        @CsvField("-")
        Address ignored;
    }

    static class Node {
        String value;
        Node next;
    }

    static class Wrapper {
        Optional<Node> node;
    }

    static class BadEmbed {
        @CsvField(embedded = true)
        String notARecord;
    }

    private static Type fieldType(String name) throws NoSuchFieldException {
        return Kinds.class.getDeclaredField(name).getGenericType();
    }

    @Test
    void testKinds() throws Exception {
        assertThat(types.resolve(fieldType("primitive")).getKind()).isEqualTo(ValueKind.INTEGER);
        assertThat(types.resolve(fieldType("boxed")).getKind()).isEqualTo(ValueKind.INTEGER);
        assertThat(types.resolve(fieldType("flag")).getKind()).isEqualTo(ValueKind.BOOLEAN);
        assertThat(types.resolve(fieldType("ratio")).getKind()).isEqualTo(ValueKind.FLOAT);
        assertThat(types.resolve(fieldType("text")).getKind()).isEqualTo(ValueKind.STRING);
        assertThat(types.resolve(fieldType("state")).getKind()).isEqualTo(ValueKind.ENUM);
        assertThat(types.resolve(fieldType("maybe")).getKind()).isEqualTo(ValueKind.OPTIONAL);
        assertThat(types.resolve(fieldType("list")).getKind()).isEqualTo(ValueKind.SEQUENCE);
        assertThat(types.resolve(fieldType("array")).getKind()).isEqualTo(ValueKind.SEQUENCE);
        assertThat(types.resolve(fieldType("set")).getKind()).isEqualTo(ValueKind.SEQUENCE);
        assertThat(types.resolve(fieldType("map")).getKind()).isEqualTo(ValueKind.MAP);
        assertThat(types.resolve(fieldType("anything")).getKind()).isEqualTo(ValueKind.DYNAMIC);
        assertThat(types.resolve(fieldType("callback")).getKind()).isEqualTo(ValueKind.DYNAMIC);
        assertThat(types.resolve(fieldType("letter")).getKind()).isEqualTo(ValueKind.UNSUPPORTED);
        assertThat(types.resolve(fieldType("builder")).getKind()).isEqualTo(ValueKind.UNSUPPORTED);
        assertThat(types.resolve(fieldType("self")).getKind()).isEqualTo(ValueKind.RECORD);
    }

    @Test
    void testGenericArgumentsAreKept() throws Exception {
        ValueType map = types.resolve(fieldType("map"));
        assertThat(map.getKeyType()).isEqualTo(String.class);
        assertThat(map.getMapValueType()).isEqualTo(Integer.class);

        assertThat(types.resolve(fieldType("list")).getElementType()).isEqualTo(String.class);
        assertThat(types.resolve(fieldType("array")).getElementType()).isEqualTo(String.class);
        assertThat(types.resolve(fieldType("maybe")).getElementType()).isEqualTo(String.class);
    }

    @Test
    void testResolutionIsCached() throws Exception {
        assertThat(types.resolve(fieldType("list"))).isSameAs(types.resolve(fieldType("list")));
    }

    @Test
    void testHooksAreAttached() {
        assertThat(types.resolve(LocalDate.class).hasEncodeHook()).isTrue();
        assertThat(types.resolve(BigDecimal.class).hasDecodeHook()).isTrue();
        assertThat(types.resolve(String.class).getHooks().isEmpty()).isTrue();
    }

    @Test
    void testWidths() throws Exception {
        assertThat(types.width(types.resolve(String.class))).isEqualTo(1);
        assertThat(types.width(types.resolve(fieldType("list")))).isEqualTo(1);
        assertThat(types.width(types.resolve(fieldType("map")))).isEqualTo(1);
        assertThat(types.width(types.resolve(Address.class))).isEqualTo(2);
        assertThat(types.width(types.resolve(LocalDate.class))).isEqualTo(1);
        // name + home(2) + work(2) + mailing(2) + since
        assertThat(types.width(types.resolve(Customer.class))).isEqualTo(8);
    }

    @Test
    void testRecursiveRecordHasNoWidth() {
        assertThatThrownBy(() -> types.width(types.resolve(Node.class)))
                .isInstanceOf(UnsupportedTypeException.class)
                .hasMessageContaining("contains itself");
        assertThatThrownBy(() -> types.width(types.resolve(Wrapper.class)))
                .isInstanceOf(UnsupportedTypeException.class);
    }

    @Test
    void testHeader() throws Exception {
        assertThat(types.header(types.resolve(Customer.class))).containsExactly(
                "name", "home.city", "home.zip", "work.city", "work.zip", "city", "zip", "since");
    }

    @Test
    void testHeaderOfRecursiveRecord() {
        assertThatThrownBy(() -> types.header(types.resolve(Node.class)))
                .isInstanceOf(UnsupportedTypeException.class);
    }

    @Test
    void testHeaderNeedsARecord() {
        assertThatThrownBy(() -> types.header(types.resolve(String.class)))
                .isInstanceOf(UnsupportedTypeException.class);
    }

    @Test
    void testEmbeddedFieldMustBeARecord() {
        assertThatThrownBy(() -> types.header(types.resolve(BadEmbed.class)))
                .isInstanceOf(UnsupportedTypeException.class)
                .hasMessageContaining("notARecord");
    }
}
