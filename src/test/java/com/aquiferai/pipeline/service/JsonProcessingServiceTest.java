package com.aquiferai.pipeline.service;

import com.aquiferai.pipeline.model.QueryComplexity;
import com.aquiferai.pipeline.model.QueryPlan;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonProcessingServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonProcessingService service = new JsonProcessingService(objectMapper);

    static record TestBean(String name, int age) {}

    static record WellReading(String wellId, int depth) {}

    @Test
    void testParseJsonResponse() {
        String raw = "Here is the result: {\"name\":\"John\", \"age\":30} and some extra text.";
        TestBean bean = service.parseJsonResponse("test", raw, TestBean.class);
        assertNotNull(bean);
        assertEquals("John", bean.name());
        assertEquals(30, bean.age());
    }

    @Test
    void testParseFencedResponse() {
        String raw = "```json\n{\"name\":\"Jane\", \"age\":25}\n```";
        TestBean bean = service.parseJsonResponse("test", raw, TestBean.class);
        assertNotNull(bean);
        assertEquals("Jane", bean.name());
    }

    @Test
    void testParseIgnoresUnknownFields() {
        String raw = "{\"name\":\"Jane\", \"age\":25, \"nickname\":\"JJ\"}";
        TestBean bean = service.parseJsonResponse("test", raw, TestBean.class);
        assertNotNull(bean);
        assertEquals(25, bean.age());
    }

    @Test
    void testParseEmptyResponse() {
        assertNull(service.parseJsonResponse("test", "", TestBean.class));
        assertNull(service.parseJsonResponse("test", null, TestBean.class));
    }

    @Test
    void testParseInvalidJson() {
        TestBean bean = service.parseJsonResponse("test", "{invalid-json}", TestBean.class);
        assertNull(bean);
    }

    @Test
    void testEnumsAreCaseInsensitive() {
        String raw = "{\"complexity\":\"compound\",\"subTasks\":[{\"id\":\"st1\",\"description\":\"List basins\"}]}";
        QueryPlan plan = service.parseJsonResponse("planner", raw, QueryPlan.class);
        assertNotNull(plan);
        assertEquals(QueryComplexity.COMPOUND, plan.complexity());
        assertEquals(1, plan.subTasks().size());
        assertTrue(plan.subTasks().get(0).dependsOn().isEmpty());
    }

    @Test
    void testUnknownEnumBecomesNull() {
        String raw = "{\"complexity\":\"VERY_HARD\",\"subTasks\":[]}";
        QueryPlan plan = service.parseJsonResponse("planner", raw, QueryPlan.class);
        assertNotNull(plan);
        assertNull(plan.complexity());
    }

    @Test
    void testToJson() {
        TestBean bean = new TestBean("Alice", 20);
        assertEquals("{\"name\":\"Alice\",\"age\":20}", service.toJson(bean));
    }

    @Test
    void testJsonMapperSettingsAreKept() {
        JsonMapper snakeCase = JsonMapper.builder()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .build();
        JsonProcessingService snakeService = new JsonProcessingService(snakeCase);

        assertEquals("{\"well_id\":\"w1\",\"depth\":3}", snakeService.toJson(new WellReading("w1", 3)));
        QueryPlan plan = snakeService.parseJsonResponse("planner", "{\"complexity\":\"Simple\",\"sub_tasks\":[]}", QueryPlan.class);
        assertNotNull(plan);
        assertEquals(QueryComplexity.SIMPLE, plan.complexity());
    }

    @Test
    void testTruncate() {
        assertEquals("short", JsonProcessingService.truncate("short", 10));
        assertEquals("line one l...", JsonProcessingService.truncate("line one\nline two", 10));
    }
}
