package com.pageanalyzer.core.payload;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SchemaDetectorTest {

    private static final ObjectMapper OM = new ObjectMapper();

    private static JsonNode json(String s) throws Exception {
        return OM.readTree(s);
    }

    @Test
    void hint_aliases_are_canonicalised() {
        assertEquals(SchemaDetector.JSONAPI, SchemaDetector.canonicalHint("JSON:API"));
        assertEquals(SchemaDetector.JSONAPI, SchemaDetector.canonicalHint("json_api"));
        assertEquals(SchemaDetector.HAL, SchemaDetector.canonicalHint("hal_json"));
        assertEquals(SchemaDetector.ELASTICSEARCH, SchemaDetector.canonicalHint("OpenSearch"));
        assertEquals(SchemaDetector.JSON_LD, SchemaDetector.canonicalHint("Schema_Org"));
        assertEquals(SchemaDetector.KIND_ITEMS, SchemaDetector.canonicalHint("kind-items"));
        assertNull(SchemaDetector.canonicalHint("graphql"));
        assertNull(SchemaDetector.canonicalHint("  "));
        assertNull(SchemaDetector.canonicalHint(null));
    }

    @Test
    void nothing_is_guessed_for_plain_payloads() throws Exception {
        assertEquals(Optional.empty(), SchemaDetector.detect(json("{\"data\":[{\"title\":\"x\"}]}"), null));
        assertEquals(Optional.empty(), SchemaDetector.detect(json("[{\"type\":\"a\",\"attributes\":{}}]"), "jsonapi"));
        assertEquals(Optional.empty(), SchemaDetector.detect(null, null));
    }

    @Test
    void odata_requires_an_odata_marker() throws Exception {
        assertEquals(Optional.empty(), SchemaDetector.detect(json("{\"value\":[{\"a\":1}]}"), null));
        assertEquals(Optional.of(SchemaDetector.ODATA),
                SchemaDetector.detect(json("{\"odata.metadata\":\"m\",\"value\":[]}"), null));
    }

    @Test
    void empty_elasticsearch_result_still_matches() throws Exception {
        assertEquals(Optional.of(SchemaDetector.ELASTICSEARCH),
                SchemaDetector.detect(json("{\"hits\":{\"total\":0,\"hits\":[]}}"), null));
        assertEquals(Optional.empty(),
                SchemaDetector.detect(json("{\"hits\":{\"hits\":[{\"title\":\"no source\"}]}}"), null));
    }

    @Test
    void hint_wins_when_several_schemas_match() throws Exception {
        // _embedded(HAL) 과 @odata.count(OData) 를 모두 가진 페이로드
        JsonNode both = json("{\"@odata.count\":1,\"_embedded\":{\"things\":[{\"name\":\"t\"}]}}");

        assertEquals(Optional.of(SchemaDetector.HAL), SchemaDetector.detect(both, null));
        assertEquals(Optional.of(SchemaDetector.ODATA), SchemaDetector.detect(both, "odata"));
    }
}
