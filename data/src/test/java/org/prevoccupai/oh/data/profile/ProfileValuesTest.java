package org.prevoccupai.oh.data.profile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.DoubleNode;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class ProfileValuesTest {

    private final ObjectMapper objectMapper = JsonMapper.builder()
        .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
        .build();

    @Test
    void toCell_convertsScalars() throws JsonProcessingException {
        JsonNode node = objectMapper.readTree("{\"int\": 3, \"dbl\": 72.5, \"flag\": true, \"text\": \"left\", \"nil\": null}");

        assertEquals(3.0, ProfileValues.toCell(node.get("int")));
        assertEquals(72.5, ProfileValues.toCell(node.get("dbl")));
        assertEquals(Boolean.TRUE, ProfileValues.toCell(node.get("flag")));
        assertEquals("left", ProfileValues.toCell(node.get("text")));
        assertNull(ProfileValues.toCell(node.get("nil")));
        assertNull(ProfileValues.toCell(node.get("absent")));
    }

    @Test
    void toCell_textIsVerbatim() throws JsonProcessingException {
        JsonNode node = objectMapper.readTree("{\"a\": \"NaN\", \"b\": \"None\", \"c\": \"\"}");

        assertEquals("NaN", ProfileValues.toCell(node.get("a")));
        assertEquals("None", ProfileValues.toCell(node.get("b")));
        assertEquals("", ProfileValues.toCell(node.get("c")));
        assertEquals("None", ProfileValues.toText(node.get("b")));
    }

    @Test
    void toCell_nonFiniteNumbersAreMissing() throws JsonProcessingException {
        JsonNode node = objectMapper.readTree("{\"mean\": NaN, \"max\": Infinity, \"min\": -Infinity}");

        assertNull(ProfileValues.toCell(node.get("mean")));
        assertNull(ProfileValues.toCell(node.get("max")));
        assertNull(ProfileValues.toCell(node.get("min")));
        assertNull(ProfileValues.toCell(DoubleNode.valueOf(Double.NaN)));
    }

    @Test
    void toCell_arrayBecomesList() throws JsonProcessingException {
        JsonNode node = objectMapper.readTree("[1, NaN, \"nan\", null]");

        assertEquals(Arrays.asList(1.0, null, "nan", null), ProfileValues.toCell(node));
    }

    @Test
    void toCell_mappingIsRejected() throws JsonProcessingException {
        JsonNode node = objectMapper.readTree("{\"a\": 1}");

        assertThrows(IllegalArgumentException.class, () -> ProfileValues.toCell(node));
    }

    @Test
    void toText_numbersAndText() throws JsonProcessingException {
        JsonNode node = objectMapper.readTree("{\"group\": 2, \"work_type\": \"office\", \"list\": [1]}");

        assertEquals("2", ProfileValues.toText(node.get("group")));
        assertEquals("office", ProfileValues.toText(node.get("work_type")));
        assertNull(ProfileValues.toText(node.get("list")));
        assertNull(ProfileValues.toText(node));
    }
}
