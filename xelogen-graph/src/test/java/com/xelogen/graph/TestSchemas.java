package com.xelogen.graph;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.xelogen.graph.Datatype.BOOL;
import static com.xelogen.graph.Datatype.IMPULSE;
import static com.xelogen.graph.Datatype.IMPULSE_LIST;
import static com.xelogen.graph.Datatype.INT;
import static com.xelogen.graph.Datatype.INT_LIST;
import static com.xelogen.graph.Datatype.SLOT;
import static com.xelogen.graph.Datatype.STRING;
import static com.xelogen.graph.Datatype.STRING_LIST;

/** Node schemas used by the graph tests; same declarations as the bundled catalog. */
public final class TestSchemas {

    private TestSchemas() {
    }

    public static NodeSpecRegistry registry() {
        return NodeSpecRegistry.of(List.of(
                spec("RootSlot", ports(), ports("*", SLOT), null),
                spec("NumChildren", ports("slot", SLOT), ports("*", INT), null),
                spec("WriteDynVar<Int>",
                        ports("write", IMPULSE_LIST, "slot", SLOT, "name", STRING, "value", INT),
                        ports("success", IMPULSE, "fail", IMPULSE), null),
                spec("Pulse", ports(), ports("*", IMPULSE), null),
                spec("StringInput", ports(), ports("*", STRING), STRING),
                spec("IntInput", ports(), ports("*", INT), INT),
                spec("BoolInput", ports(), ports("*", BOOL), BOOL),
                spec("ImpulseDisplay", ports("impulse", IMPULSE_LIST), ports(), null),
                spec("PlusOne<Int>", ports("value", INT), ports("*", INT), null),
                spec("Plus<String>", ports("values", STRING_LIST), ports("*", STRING), null),
                spec("Plus<Int>", ports("values", INT_LIST), ports("*", INT), null),
                spec("If", ports("impulse", IMPULSE_LIST, "condition", BOOL), ports("true", IMPULSE, "false", IMPULSE), null)
        ));
    }

    public static Graph newGraph() {
        return new Graph(registry());
    }

    private static NodeSpec spec(String name, Map<String, Datatype> inputs, Map<String, Datatype> outputs, Datatype content) {
        return new NodeSpec(name, inputs, outputs, content);
    }

    /** Ordered name/type pairs. */
    static Map<String, Datatype> ports(Object... nameTypePairs) {
        Map<String, Datatype> map = new LinkedHashMap<>();
        for (int i = 0; i < nameTypePairs.length; i += 2) {
            map.put((String) nameTypePairs[i], (Datatype) nameTypePairs[i + 1]);
        }
        return map;
    }
}
