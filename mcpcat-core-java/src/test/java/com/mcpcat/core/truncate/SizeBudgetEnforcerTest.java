package com.mcpcat.core.truncate;

import com.mcpcat.core.json.EventJson;
import com.mcpcat.core.model.Event;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class SizeBudgetEnforcerTest {

    private static Map<String, Object> map(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
        return m;
    }

    @Test
    void eventWithinBudgetReturnedAsIs() {
        Event e = new Event();
        e.parameters = map("q", "small");
        assertSame(e, SizeBudgetEnforcer.enforce(e));
    }

    @Test
    void deepCopyDetachesTrees() {
        Event e = new Event();
        e.parameters = map("list", new ArrayList<>(List.of("a")), "inner", map("k", "v"));

        Event copy = SizeBudgetEnforcer.deepCopy(e);

        assertEquals(e.parameters, copy.parameters);
        assertNotSame(e.parameters, copy.parameters);
        assertNotSame(((Map<?, ?>) e.parameters).get("list"), ((Map<?, ?>) copy.parameters).get("list"));
        assertNotSame(((Map<?, ?>) e.parameters).get("inner"), ((Map<?, ?>) copy.parameters).get("inner"));
    }

    @Test
    void surgeryReachesMetadataStrings() {
        Event e = new Event();
        e.identifyActorGivenId = "g".repeat(4_000);
        e.parameters = map("note", "n".repeat(500));

        Event result = SizeBudgetEnforcer.truncateLargestFields(e, 2_000);

        assertTrue(EventJson.byteSize(result) <= 2_000);
        assertTrue(result.identifyActorGivenId.length() < 4_000);
        assertEquals(4_000, e.identifyActorGivenId.length());
    }

    @Test
    void smallReductionsSkipped() {
        // Over budget by a few bytes; the 110-char string can only lose 55 chars,
        // the 100-char string is not a candidate at all
        Event e = new Event();
        e.parameters = map("a", "a".repeat(110), "b", "b".repeat(100));
        int size = EventJson.byteSize(e);

        Event result = SizeBudgetEnforcer.truncateLargestFields(e, size - 5);

        Map<?, ?> params = (Map<?, ?>) result.parameters;
        assertEquals(58, ((String) params.get("a")).length());
        assertEquals(100, ((String) params.get("b")).length());
    }

    @Test
    void surgeryLeavesInputUntouched() {
        Map<String, Object> params = map("s", "s".repeat(10_000));
        Event e = new Event();
        e.parameters = params;

        SizeBudgetEnforcer.truncateLargestFields(e, 1_000);

        assertEquals(10_000, ((String) params.get("s")).length());
    }
}
