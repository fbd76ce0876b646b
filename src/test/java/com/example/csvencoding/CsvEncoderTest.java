package com.example.csvencoding;

import com.example.csvencoding.exception.CsvException;
import com.example.csvencoding.exception.HookException;
import com.example.csvencoding.exception.UnsupportedTypeException;
import com.example.csvencoding.io.CommonsCsvConfig;
import com.example.csvencoding.io.CommonsCsvRowWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class CsvEncoderTest {

    private StringWriter out;
    private CsvEncoder encoder;

    @BeforeEach
    void setUp() throws IOException {
        out = new StringWriter();
        encoder = new CsvEncoder(new CommonsCsvRowWriter(out, new CommonsCsvConfig()));
    }

    static class Basic {
        String string = "henry";
        int number = 23;
        boolean flag = true;
        double ratio = 60.429;
    }

    static class Boxed {
        String string = "henry";
        Integer number = 23;
        Boolean flag = true;
        Double ratio = 60.429;
    }

    static class Sequences {
        List<String> strings = List.of("vin", "diesel");
        int[] ints = {23, 24};
        boolean[] bools = {true, false};
        List<Double> floats = List.of(60.429, 50.534);
        String[] pstrings = {"vin"};
    }

    static class Child {
        List<String> names;

        Child() {}

        Child(String... names) {
            this.names = List.of(names);
        }
    }

    static class Parent {
        Child child = new Child("uno", "dos");
        Child stepChild = new Child("wut");
    }

    static class Kids {
        List<String> names;
        List<Integer> ages;
    }

    static class Family {
        Kids child;
    }

    static class Middle {
        String label;
        Kids kids;
    }

    static class Outer {
        Middle middle;
        String tail = "end";
    }

    static class WithTime {
        Instant time = LocalDateTime.of(2000, 10, 9, 8, 7, 6, 5).toInstant(ZoneOffset.UTC);
    }

    public static class CellMap extends HashMap<String, String> implements CsvGetter, CsvSetter {
        private static final long serialVersionUID = 1L;

        @Override
        public List<String> getCells() {
            return List.of("getcsv");
        }

        @Override
        public void setCells(List<String> cells) {
            clear();
            put("set", "csv");
        }
    }

    static class WithCustom {
        CellMap json = new CellMap();

        WithCustom() {
            json.put("name", "henry");
        }
    }

    static class Sentinels {
        @CsvField(omitEmpty = true)
        String name = "";
        Integer age;
    }

    static class Skips {
        private String secret = "riddick";
        @CsvField("-")
        String publicSkipped = "dom";
        transient String cached = "cache";
        String name = "vin";
    }

    static class Named {
        String name;

        Named() {}

        Named(String name) {
            this.name = name;
        }
    }

    static class WithEmbedded {
        @CsvField(embedded = true)
        Named named = new Named("riddick");
    }

    static class Employee extends Named {
        int id = 7;

        Employee() {
            super("riddick");
        }
    }

    static class WithMap {
        Map<String, Integer> scores = new LinkedHashMap<>();
    }

    static class WithOmittedRecord {
        @CsvField(omitEmpty = true)
        Kids kids = new Kids();
        String tail = "x";
    }

    static class WithOptional {
        Optional<Kids> kids = Optional.empty();
        Optional<String> nick = Optional.of("vin");
    }

    static class Floats {
        double big = 1e21;
        double small = 0.000001;
        float single = 1.1f;
        double whole = 3.0;
        double negative = -2.5;
        double negativeZero = -0.0;
        float negativeZeroSingle = -0.0f;
    }

    enum Color { RED, GREEN }

    static class WithEnum {
        Color color = Color.GREEN;
    }

    static class WithChar {
        char initial = 'x';
    }

    static class Exploding implements TextMarshaler {
        @Override
        public String toText() {
            throw new IllegalStateException("boom");
        }

        @Override
        public String toString() {
            return "exploding";
        }
    }

    static class WithExploding {
        Exploding exploding = new Exploding();
    }

    static class Address {
        String city;
        String zip;
    }

    static class Audit {
        String created;
    }

    static class Person {
        String name;
        Address address;
        @CsvField(embedded = true)
        Audit audit;
        Optional<Address> billing;
        @CsvField("labels")
        List<String> tags;
        Instant at;
    }

    record Point(int x, @CsvField("tag") String label) {
    }

    static class Placed {
        Point point = new Point(3, "home");
        String name = "vin";
    }

    @Test
    void testEncodeBasicTypes() throws CsvException {
        encoder.encode(new Basic());
        assertThat(out.toString()).isEqualTo("henry,23,true,60.429\n");
    }

    @Test
    void testEncodeBoxedTypes() throws CsvException {
        encoder.encode(new Boxed());
        assertThat(out.toString()).isEqualTo("henry,23,true,60.429\n");
    }

    @Test
    void testEncodeSequencesIntoSingleCells() throws CsvException {
        encoder.encode(new Sequences());
        assertThat(out.toString()).isEqualTo("\"vin,diesel\",\"23,24\",\"true,false\",\"60.429,50.534\",vin\n");
    }

    @Test
    void testEncodeNestedRecords() throws CsvException {
        encoder.encode(new Parent());
        assertThat(out.toString()).isEqualTo("\"uno,dos\",wut\n");
    }

    @Test
    void testEncodeTime() throws CsvException {
        encoder.encode(new WithTime());
        assertThat(out.toString()).isEqualTo("2000-10-09T08:07:06.000000005Z\n");
    }

    @Test
    void testNullRecordExpandsToItsWidth() throws CsvException {
        encoder.encode(new Family());
        Family family = new Family();
        family.child = new Kids();
        family.child.names = List.of("vin");
        family.child.ages = List.of(47);
        encoder.encode(family);
        assertThat(out.toString()).isEqualTo("NULL,NULL\nvin,47\n");
    }

    @Test
    void testNullRecordWidthCountsNestedColumns() throws CsvException {
        assertThat(encoder.toCells(new Outer())).containsExactly("NULL", "NULL", "NULL", "end");
    }

    @Test
    void testEmptyOptionalExpandsLikeNull() throws CsvException {
        assertThat(encoder.toCells(new WithOptional())).containsExactly("NULL", "NULL", "vin");
    }

    @Test
    void testCellGetterWinsOverMapHandling() throws CsvException {
        encoder.encode(new WithCustom());
        assertThat(out.toString()).isEqualTo("getcsv\n");
    }

    @Test
    void testCustomEmptyAndNilValues() throws CsvException {
        encoder.setEmptyValue("VIN");
        encoder.setNilValue("IMMORTAL");
        encoder.encode(new Sentinels());
        assertThat(out.toString()).isEqualTo("VIN,IMMORTAL\n");
    }

    @Test
    void testOmitEmptyRecordIsOneCell() throws CsvException {
        encoder.setEmptyValue("EMPTY");
        assertThat(encoder.toCells(new WithOmittedRecord())).containsExactly("EMPTY", "x");
    }

    @Test
    void testOmitEmptyKeepsNonZeroValues() throws CsvException {
        Sentinels sentinels = new Sentinels();
        sentinels.name = "vin";
        sentinels.age = 0;
        assertThat(encoder.toCells(sentinels)).containsExactly("vin", "0");
    }

    @Test
    void testSkipPrivateTransientAndDashFields() throws CsvException {
        encoder.encode(new Skips());
        assertThat(out.toString()).isEqualTo("vin\n");
    }

    @Test
    void testEmbeddedFieldsAreSpliced() throws CsvException {
        encoder.encode(new WithEmbedded());
        assertThat(out.toString()).isEqualTo("riddick\n");
    }

    @Test
    void testInheritedFieldsComeFirst() throws CsvException {
        assertThat(encoder.toCells(new Employee())).containsExactly("riddick", "7");
    }

    @Test
    void testMapIntoSingleCell() throws CsvException {
        WithMap withMap = new WithMap();
        withMap.scores.put("vin", 47);
        assertThat(encoder.toCells(withMap)).containsExactly("vin:47");
    }

    @Test
    void testMapEntryOrderIsNotFixed() throws CsvException {
        WithMap withMap = new WithMap();
        withMap.scores = new HashMap<>();
        withMap.scores.put("vin", 47);
        withMap.scores.put("dom", 52);
        List<String> cells = encoder.toCells(withMap);
        assertThat(cells).hasSize(1);
        assertThat(cells.get(0).split(",")).containsExactlyInAnyOrder("vin:47", "dom:52");
    }

    @Test
    void testFloatsUseShortestPlainForm() throws CsvException {
        assertThat(encoder.toCells(new Floats()))
                .containsExactly("1000000000000000000000", "0.000001", "1.1", "3", "-2.5", "-0", "-0");
    }

    @Test
    void testEnumsUseTheirName() throws CsvException {
        assertThat(encoder.toCells(new WithEnum())).containsExactly("GREEN");
    }

    @Test
    void testSequenceOfRecordsJoinsTheirCells() throws CsvException {
        Named[] people = {new Named("vin"), new Named("dom")};
        Object holder = new Object() {
            final List<Named> crew = List.of(people);
        };
        assertThat(encoder.toCells(holder)).containsExactly("vin,dom");
    }

    @Test
    void testNullElementsUseNilValue() throws CsvException {
        List<String> strings = new ArrayList<>();
        strings.add("vin");
        strings.add(null);
        Object holder = new Object() {
            final List<String> values = strings;
        };
        assertThat(encoder.toCells(holder)).containsExactly("vin,NULL");
    }

    @Test
    void testEncodeHeader() throws CsvException {
        encoder.encodeHeader(Person.class);
        assertThat(out.toString()).isEqualTo("name,address.city,address.zip,created,billing.city,billing.zip,labels,at\n");
    }

    @Test
    void testHeaderMatchesRowWidth() throws CsvException {
        assertThat(encoder.toCells(new Person())).hasSize(8);
    }

    @Test
    void testJavaRecordsEncodeThroughTheirComponents() throws CsvException {
        encoder.encodeHeader(Placed.class);
        encoder.encode(new Placed());
        encoder.encode(new Point(1, "top"));
        assertThat(out.toString()).isEqualTo("point.x,point.tag,name\n3,home,vin\n1,top\n");
    }

    @Test
    void testNullJavaRecordExpandsToItsWidth() throws CsvException {
        Placed placed = new Placed();
        placed.point = null;
        assertThat(encoder.toCells(placed)).containsExactly("NULL", "NULL", "vin");
    }

    @Test
    void testUnsupportedTypeNamesTheField() {
        assertThatThrownBy(() -> encoder.encode(new WithChar()))
                .isInstanceOf(UnsupportedTypeException.class)
                .hasMessageContaining("field initial=`x`");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testHookFailureIsWrapped() {
        assertThatThrownBy(() -> encoder.encode(new WithExploding()))
                .isInstanceOf(HookException.class)
                .hasMessageContaining("field exploding=`exploding`")
                .hasMessageContaining("boom")
                .hasRootCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void testFailureIsSticky() {
        CsvException first = catchThrowableOfType(() -> encoder.encode(new WithChar()), CsvException.class);
        CsvException second = catchThrowableOfType(() -> encoder.encode(new Basic()), CsvException.class);

        assertThat(first).isNotNull();
        assertThat(second).isSameAs(first);
        assertThat(encoder.getFailure()).containsSame(first);
        assertThat(out.toString()).isEmpty();
    }
}
