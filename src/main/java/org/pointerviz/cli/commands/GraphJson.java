package org.pointerviz.cli.commands;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.pointerviz.layout.LayoutResult;
import org.pointerviz.layout.Position;
import org.pointerviz.model.MemoryGraph;
import org.pointerviz.model.MemoryObject;
import org.pointerviz.model.Pointer;
import org.pointerviz.model.Reference;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * JSON views of resolved graphs and layouts. Objects become plain maps so absent targets show up as
 * {@code null} instead of Gson's rendering of {@link java.util.Optional}.
 */
final class GraphJson {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .serializeNulls()
        .create();

    private GraphJson() {
    }

    static String graph(MemoryGraph graph) {
        return GSON.toJson(Map.of("objects", objects(graph)));
    }

    static String layout(MemoryGraph graph, LayoutResult layout) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("width", layout.width());
        root.put("height", layout.height());
        root.put("xSpacing", layout.xSpacing());
        root.put("ySpacing", layout.ySpacing());
        root.put("margin", layout.margin());
        root.put("nodeWidth", layout.nodeWidth());

        List<Map<String, Object>> nodes = new ArrayList<>();
        for (MemoryObject object : graph.objects()) {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("address", object.address());
            node.put("name", object.name());
            node.put("layer", layout.layerOf(object.address()));
            Position position = layout.positionOf(object.address()).orElseThrow();
            node.put("x", position.x());
            node.put("y", position.y());
            node.put("lines", object.displayLines());
            nodes.add(node);
        }
        root.put("nodes", nodes);

        List<Map<String, Object>> edges = new ArrayList<>();
        graph.edges().forEach(edge -> {
            Map<String, Object> json = new LinkedHashMap<>();
            json.put("from", edge.fromAddress());
            json.put("to", edge.toAddress());
            json.put("kind", edge.kind().name());
            edges.add(json);
        });
        root.put("edges", edges);
        return GSON.toJson(root);
    }

    private static List<Map<String, Object>> objects(MemoryGraph graph) {
        List<Map<String, Object>> objects = new ArrayList<>();
        for (MemoryObject object : graph.objects()) {
            Map<String, Object> json = new LinkedHashMap<>();
            json.put("name", object.name());
            json.put("kind", object.kind().name());
            json.put("type", object.typeDescription());
            json.put("address", object.address());
            json.put("pointsTo", object.pointsTo().orElse(null));
            json.put("value", object.value().orElse(null));
            json.put("isValueConst", object.isValueConst());
            if (object instanceof Pointer pointer) {
                json.put("isPointerConst", pointer.isPointerConst());
                json.put("indirectionLevel", pointer.indirectionLevel());
            } else if (object instanceof Reference reference) {
                json.put("targetIndirectionLevel", reference.targetIndirectionLevel());
            }
            json.put("modifiability", object.modifiability());
            objects.add(json);
        }
        return objects;
    }
}
