package org.javai.httperror;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class ResponseBodyTest {

    @Test
    void bytes_areCopiedInAndOut() {
        byte[] source = {1, 2, 3};
        ResponseBody body = ResponseBody.of(source);

        source[0] = 9;
        body.bytes()[1] = 9;

        assertThat(body.bytes()).containsExactly(1, 2, 3);
        assertThat(body.size()).isEqualTo(3);
    }

    @Test
    void emptyBytes_isEmptyBody() {
        assertThat(ResponseBody.of(new byte[0])).isSameAs(ResponseBody.empty());
        assertThat(ResponseBody.empty().isEmpty()).isTrue();
    }

    @Test
    void asString_decodesWithCharset() {
        ResponseBody body = ResponseBody.of("héllo".getBytes(StandardCharsets.UTF_8));

        assertThat(body.asString(StandardCharsets.UTF_8)).isEqualTo("héllo");
        assertThat(body).hasToString("ResponseBody[6 bytes]");
    }
}
