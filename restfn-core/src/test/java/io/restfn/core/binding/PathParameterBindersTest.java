package io.restfn.core.binding;

import io.restfn.core.HttpMethod;
import io.restfn.core.ServerRequest;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PathParameterBindersTest {

    @Test
    void signedIntegersRoundTripAtTheirBounds() throws Exception {
        assertThat(bind(byte.class, false, String.valueOf(Byte.MIN_VALUE))).isEqualTo(Byte.MIN_VALUE);
        assertThat(bind(Byte.class, false, String.valueOf(Byte.MAX_VALUE))).isEqualTo(Byte.MAX_VALUE);
        assertThat(bind(short.class, false, String.valueOf(Short.MIN_VALUE))).isEqualTo(Short.MIN_VALUE);
        assertThat(bind(int.class, false, String.valueOf(Integer.MAX_VALUE))).isEqualTo(Integer.MAX_VALUE);
        assertThat(bind(Integer.class, false, "-42")).isEqualTo(-42);
        assertThat(bind(long.class, false, String.valueOf(Long.MIN_VALUE))).isEqualTo(Long.MIN_VALUE);
    }

    @Test
    void signedIntegersRejectOverflow() {
        assertRejected(byte.class, false, "128");
        assertRejected(short.class, false, "-32769");
        assertRejected(int.class, false, "2147483648");
        assertRejected(long.class, false, "9223372036854775808");
    }

    @Test
    void unsignedIntegersAcceptTheirMaximum() throws Exception {
        assertThat(bind(byte.class, true, "255")).isEqualTo((byte) -1);
        assertThat(bind(Byte.class, true, "200")).isEqualTo((byte) 200);
        assertThat(bind(short.class, true, "65535")).isEqualTo((short) -1);
        assertThat(bind(int.class, true, "4294967295")).isEqualTo(-1);
        assertThat(bind(long.class, true, "18446744073709551615")).isEqualTo(-1L);
        assertThat(bind(long.class, true, "12345")).isEqualTo(12345L);
    }

    @Test
    void unsignedIntegersRejectMaximumPlusOneAndNegatives() {
        assertRejected(byte.class, true, "256");
        assertRejected(short.class, true, "65536");
        assertRejected(int.class, true, "4294967296");
        assertRejected(long.class, true, "18446744073709551616");
        assertRejected(int.class, true, "-1");
        assertRejected(byte.class, true, "-1");
    }

    @Test
    void integersAcceptOnlyAsciiDigits() throws Exception {
        assertRejected(int.class, false, "\u0661\u0660");
        assertRejected(int.class, false, "\uFF11\uFF10");
        assertRejected(long.class, true, "\u0661\u0660");
        assertRejected(byte.class, true, "\uFF11");
        assertRejected(int.class, false, "-");
        assertRejected(int.class, false, "");
        assertRejected(int.class, true, "+7");
        assertRejected(short.class, true, "+7");
        assertThat(bind(int.class, false, "+7")).isEqualTo(7);
    }

    @Test
    void floatingPoint() throws Exception {
        assertThat(bind(float.class, false, "1.5")).isEqualTo(1.5f);
        assertThat(bind(Double.class, false, "-2.25e3")).isEqualTo(-2250.0);
        assertThat(bind(double.class, false, "Infinity")).isEqualTo(Double.POSITIVE_INFINITY);
        assertRejected(float.class, false, "1e39");
        assertRejected(double.class, false, "1e309");
        assertRejected(double.class, false, "1.5d");
        assertRejected(float.class, false, " 1.5");
    }

    @Test
    void stringsAreTakenVerbatim() throws Exception {
        assertThat(bind(String.class, false, "a b%20c")).isEqualTo("a b%20c");
    }

    @Test
    void failureNamesParameterAndKind() {
        assertThatThrownBy(() -> bind(int.class, false, "ten"))
                .isInstanceOf(BindingException.class)
                .hasMessage("invalid value for path parameter 'p': \"ten\" is not a valid int32");
        assertThatThrownBy(() -> bind(short.class, true, "70000"))
                .hasMessageEndingWith("is not a valid uint16");
    }

    @Test
    void missingParameterFails() {
        ParameterBinder binder = PathParameterBinders.forType("id", int.class, false);
        ServerRequest request = new ServerRequest(HttpMethod.GET, URI.create("http://localhost/"), Map.of(), null);
        assertThatThrownBy(() -> binder.bind(request))
                .isInstanceOf(BindingException.class)
                .hasMessageContaining("missing path parameter 'id'");
    }

    @Test
    void unsupportedTypesAreRegistrationErrors() {
        assertThat(PathParameterBinders.supports(boolean.class, false)).isFalse();
        assertThat(PathParameterBinders.supports(String.class, true)).isFalse();
        assertThat(PathParameterBinders.supports(double.class, true)).isFalse();
        assertThatThrownBy(() -> PathParameterBinders.forType("flag", boolean.class, false))
                .isInstanceOf(InvalidHandlerException.class)
                .hasMessageContaining("boolean");
        assertThatThrownBy(() -> PathParameterBinders.forType("name", String.class, true))
                .isInstanceOf(InvalidHandlerException.class)
                .hasMessageContaining("unsigned");
    }

    private static Object bind(Class<?> type, boolean unsigned, String raw) throws BindingException {
        ServerRequest request = new ServerRequest(HttpMethod.GET, URI.create("http://localhost/"), Map.of(), null)
                .withPathParameters(Map.of("p", raw));
        return PathParameterBinders.forType("p", type, unsigned).bind(request);
    }

    private static void assertRejected(Class<?> type, boolean unsigned, String raw) {
        assertThatThrownBy(() -> bind(type, unsigned, raw))
                .as("%s%s from \"%s\"", unsigned ? "unsigned " : "", type, raw)
                .isInstanceOf(BindingException.class);
    }
}
