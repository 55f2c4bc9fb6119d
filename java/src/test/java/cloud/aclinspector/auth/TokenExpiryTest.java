package cloud.aclinspector.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenExpiryTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void parsesOwnedFormat() {
        assertEquals(Optional.of(Instant.parse("2025-10-22T23:53:05Z")), TokenExpiry.parseOwned("2025-10-22T23:53:05Z"));
        assertTrue(TokenExpiry.parseOwned("not a date").isEmpty());
        assertTrue(TokenExpiry.parseOwned("").isEmpty());
    }

    @Test
    void parsesForeignFormatWithNanosAndOffset() {
        Optional<Instant> expiry = TokenExpiry.parseForeign("2025-10-31T01:22:03.598349702+10:00");

        assertEquals(Instant.parse("2025-10-30T15:22:03.598349702Z"), expiry.orElseThrow());
    }

    @Test
    void foreignFormatAcceptsZuluAndMissingOffset() {
        assertEquals(Instant.parse("2025-10-30T15:22:03Z"), TokenExpiry.parseForeign("2025-10-30T15:22:03Z").orElseThrow());
        assertEquals(Instant.parse("2025-10-30T15:22:03.5Z"),
            TokenExpiry.parseForeign("2025-10-30T15:22:03.5").orElseThrow());
        assertTrue(TokenExpiry.parseForeign("yesterday").isEmpty());
    }

    @Test
    void detectPicksParserByField() throws Exception {
        assertEquals(Instant.parse("2025-10-22T23:53:05Z"),
            TokenExpiry.detect(MAPPER.readTree("{\"expires_at\":\"2025-10-22T23:53:05Z\"}")).orElseThrow());
        assertEquals(Instant.parse("2025-10-30T15:22:03.598349702Z"),
            TokenExpiry.detect(MAPPER.readTree("{\"expiry\":\"2025-10-31T01:22:03.598349702+10:00\"}")).orElseThrow());
        assertTrue(TokenExpiry.detect(MAPPER.readTree("{\"access_token\":\"x\"}")).isEmpty());
    }

    @Test
    void formatsOwnedExpiryInWholeSeconds() {
        assertEquals("2025-10-22T23:53:05Z", TokenExpiry.formatOwned(Instant.parse("2025-10-22T23:53:05.987Z")));
    }
}
