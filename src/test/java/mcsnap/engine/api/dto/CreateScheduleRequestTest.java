package mcsnap.engine.api.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import mcsnap.engine.api.Json;
import mcsnap.engine.error.ValidationException;
import mcsnap.engine.model.ActionKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CreateScheduleRequestTest {

    private final ObjectMapper mapper = Json.mapper();

    @Test
    void deserializesAndIgnoresUnknownFields() throws Exception {
        CreateScheduleRequest request = mapper.readValue("""
                {"kind":"world-backup","serverName":"worlds","name":" Nightly ",
                 "cronExpression":"0 3 * * *","retentionMaxAgeDays":14,"extra":true}
                """, CreateScheduleRequest.class);

        request.validate();
        assertEquals(ActionKind.WORLD_BACKUP, request.actionKind());
        assertEquals("Nightly", request.trimmedName());
        assertEquals(14, request.retentionMaxAgeDays());
        assertNull(request.retentionCount());
        assertTrue(request.enabledOrDefault());
    }

    @Test
    void kindDefaultsToConfigSnapshot() throws Exception {
        CreateScheduleRequest request = mapper.readValue(
                "{\"serverName\":\"lobby\",\"name\":\"n\",\"cronExpression\":\"0 * * * *\",\"enabled\":false}",
                CreateScheduleRequest.class);

        assertEquals(ActionKind.CONFIG_SNAPSHOT, request.actionKind());
        assertFalse(request.enabledOrDefault());
    }

    @Test
    void validateRejectsBadFields() {
        assertThrows(ValidationException.class,
                () -> new CreateScheduleRequest("snapshot", "lobby", "n", "0 3 * * *", null, null, null).validate());
        assertThrows(ValidationException.class,
                () -> CreateScheduleRequest.of(null, "n", "0 3 * * *").validate());
        assertThrows(ValidationException.class,
                () -> CreateScheduleRequest.of("lobby", "n", "* * *").validate());
        assertThrows(ValidationException.class,
                () -> CreateScheduleRequest.of("lobby", "n", "0 3 * * *").withRetention(null, 0).validate());
    }

    @Test
    void updateRequestValidatesOnlyPresentFields() {
        new UpdateScheduleRequest(null, null, null, null, true, null).validate();
        assertTrue(new UpdateScheduleRequest(null, null, null, null, null, null).isEmpty());
        assertFalse(UpdateScheduleRequest.replaceRetention(null, null).isEmpty());
        assertThrows(ValidationException.class, () -> UpdateScheduleRequest.cron("0 25 * * *").validate());
        assertThrows(ValidationException.class,
                () -> new UpdateScheduleRequest("", null, null, null, null, null).validate());
    }
}
