package cloud.aclinspector.internal;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HttpUtilTest {

    @Test
    void formEncodeSkipsBlankValues() {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("client_secret", null);
        form.put("scope", "Files.Read offline_access");
        form.put("empty", "  ");

        assertEquals("grant_type=refresh_token&scope=Files.Read+offline_access", HttpUtil.formEncode(form));
    }

    @Test
    void encodePathKeepsSlashes() {
        assertEquals("/Docs/My%20File%232.txt", HttpUtil.encodePath("/Docs/My File#2.txt"));
        assertEquals("Shared", HttpUtil.encodePath("Shared"));
    }
}
