package proto.runtime.mirror;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.Map;

/**
 * 把镜像值序列化为 JSON，供调试器前端显示。
 *
 * <ul>
 *   <li>标量 → JSON 原始值，null / 未赋值 → {@code null}</li>
 *   <li>数组快照 → JSON 数组</li>
 *   <li>类实例和未展开的数组 → {@code {"type": ..., "handle": n}}</li>
 *   <li>环回边 → {@code {"cycle": handle}}</li>
 * </ul>
 */
public final class ObjJsonWriter {

    private final Gson gson;

    public ObjJsonWriter() {
        this(false);
    }

    public ObjJsonWriter(boolean prettyPrinting) {
        GsonBuilder builder = new GsonBuilder().serializeNulls();
        if (prettyPrinting) {
            builder.setPrettyPrinting();
        }
        this.gson = builder.create();
    }

    public String toJson(Obj obj) {
        return gson.toJson(toJsonTree(obj));
    }

    /** 属性表（{@link ExecutionMirror#getProperties}）→ JSON 对象，保持字段顺序 */
    public String toJson(Map<String, Obj> properties) {
        JsonObject result = new JsonObject();
        for (Map.Entry<String, Obj> entry : properties.entrySet()) {
            result.add(entry.getKey(), toJsonTree(entry.getValue()));
        }
        return gson.toJson(result);
    }

    public JsonElement toJsonTree(Obj obj) {
        if (obj.isCycleReference()) {
            JsonObject cycle = new JsonObject();
            cycle.addProperty("cycle", (Long) obj.getPayload());
            return cycle;
        }

        Object payload = obj.getPayload();
        if (payload == null) {
            return JsonNull.INSTANCE;
        }
        if (payload instanceof DsasmArray) {
            JsonArray array = new JsonArray();
            for (Obj member : ((DsasmArray) payload).getMembers()) {
                array.add(toJsonTree(member));
            }
            return array;
        }
        if (obj.getDsasmValue().isPointer() || obj.getDsasmValue().isArray()) {
            JsonObject ref = new JsonObject();
            ref.addProperty("type", obj.getType().getName());
            ref.addProperty("handle", (Long) payload);
            return ref;
        }
        if (payload instanceof Number) {
            return new JsonPrimitive((Number) payload);
        }
        if (payload instanceof Boolean) {
            return new JsonPrimitive((Boolean) payload);
        }
        if (payload instanceof Character) {
            return new JsonPrimitive((Character) payload);
        }
        return new JsonPrimitive(payload.toString());
    }
}
