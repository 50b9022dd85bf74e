package com.gdin.inspection.lodbook.index.operation;

import com.gdin.inspection.lodbook.models.AdvisoryKind;
import com.gdin.inspection.lodbook.models.BuildContext;
import com.gdin.inspection.lodbook.models.GraphNode;
import com.gdin.inspection.lodbook.models.ListValue;
import com.gdin.inspection.lodbook.models.NestedObjectValue;
import com.gdin.inspection.lodbook.models.ObjectValue;
import com.gdin.inspection.lodbook.models.PropertyValue;
import com.gdin.inspection.lodbook.models.Record;
import com.gdin.inspection.lodbook.models.ScalarValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 将实体记录递归规范化为图谱节点：
 * type 映射为图谱类型，id 改名为 @id，
 * 非顶层的 name 视为对另一条记录的引用并补全为 {name, @id, @type[, image]} 链接。
 */
@Slf4j
@Component
public class GraphCompiler {

    public static final String KEY_NAME = "name";
    public static final String KEY_TYPE = "type";
    public static final String KEY_ID = "id";
    public static final String IMAGE_TYPE = "ImageObject";

    public GraphNode hydrate(BuildContext ctx, Record record) {
        if (record == null) throw new IllegalArgumentException("record 不能为空");
        if (record.getName() == null) throw new IllegalArgumentException("record 缺少 name: " + record);

        Map<String, PropertyValue> entries = record.getProperties() == null ? Map.of() : record.getProperties();
        ObjectValue self = new NestedObjectValue(entries);

        Map<String, Object> properties = new LinkedHashMap<>();
        for (Map.Entry<String, PropertyValue> entry : entries.entrySet()) {
            // 顶层 name 是记录自身的名字，不是引用
            if (KEY_NAME.equals(entry.getKey())) continue;
            properties.putAll(extractProperties(ctx, self, entry.getKey(), entry.getValue()));
        }

        Object explicitId = properties.remove("@id");
        Object type = properties.remove("@type");
        String id = explicitId != null
                ? String.valueOf(explicitId)
                : ctx.entityUri(ctx.getTypeRegistry().collection(record.getType()), record.getName());

        return new GraphNode(id, type == null ? null : String.valueOf(type), record.getName(), properties);
    }

    /**
     * 按值的种类分派，返回以 key（或规范化后的 key）为键的片段。
     */
    private Map<String, Object> extractProperties(BuildContext ctx, ObjectValue enclosing, String key, PropertyValue value) {
        if (value == null) {
            Map<String, Object> properties = new LinkedHashMap<>();
            properties.put(key, null);
            return properties;
        }
        switch (value.kind()) {
            case REFERENCE:
            case NESTED_OBJECT:
                return processObject(ctx, key, (ObjectValue) value);
            case LIST:
                return processList(ctx, key, (ListValue) value);
            default:
                return processValue(ctx, enclosing, key, (ScalarValue) value);
        }
    }

    private Map<String, Object> processObject(BuildContext ctx, String key, ObjectValue value) {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (Map.Entry<String, PropertyValue> entry : value.getEntries().entrySet()) {
            properties.putAll(extractProperties(ctx, value, entry.getKey(), entry.getValue()));
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(key, properties);
        return result;
    }

    /**
     * 每个元素按单属性对象处理，随后丢弃元素层的 key，只保留其值。
     * 元素只产生一个值时直接保留该值；产生多个值时（例如列表属性本身叫 name）保留值列表。
     */
    private Map<String, Object> processList(BuildContext ctx, String key, ListValue value) {
        List<Object> values = new ArrayList<>();
        for (PropertyValue item : value.getItems()) {
            Map<String, Object> wrapped = extractProperties(ctx, null, key, item);
            List<Object> itemValues = new ArrayList<>(wrapped.values());
            values.add(itemValues.size() == 1 ? itemValues.get(0) : itemValues);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(key, values);
        return result;
    }

    private Map<String, Object> processValue(BuildContext ctx, ObjectValue enclosing, String key, ScalarValue value) {
        Map<String, Object> properties = new LinkedHashMap<>();
        if (KEY_NAME.equals(key)) {
            properties.put(KEY_NAME, value.getValue());
            properties.putAll(hydrateLink(ctx, enclosing, value.asString()));
        } else if (KEY_TYPE.equals(key) || "@type".equals(key)) {
            properties.put("@type", resolveType(ctx, value.asString(), null));
        } else if (KEY_ID.equals(key) || "@id".equals(key)) {
            properties.put("@id", value.getValue());
        } else {
            properties.put(key, value.getValue());
        }
        return properties;
    }

    /**
     * 按 name 查找记录并补全链接属性。所在对象已带 id/type 时不再生成，避免覆盖。
     */
    Map<String, Object> hydrateLink(BuildContext ctx, ObjectValue enclosing, String name) {
        Map<String, Object> link = new LinkedHashMap<>();
        link.put(KEY_NAME, name);

        Optional<Record> found = ctx.getRecordStore().findByName(name);
        if (found.isEmpty()) {
            ctx.advise(AdvisoryKind.UNRESOLVED_REFERENCE, name, "未找到同名记录，仅保留 name");
            return link;
        }

        Record record = found.get();
        String type = resolveType(ctx, record.getType(), name);
        if (enclosing == null || !enclosing.hasId()) {
            // 与被引用记录自身节点的 @id 保持一致
            link.put("@id", record.getId() != null
                    ? record.getId()
                    : ctx.entityUri(ctx.getTypeRegistry().collection(record.getType()), name));
        }
        if (enclosing == null || !enclosing.hasType()) {
            link.put("@type", type);
        }
        PropertyValue image = record.get("image");
        if (type != null && type.contains(IMAGE_TYPE) && image != null) {
            link.put("image", toPlain(image));
        }
        return link;
    }

    private String resolveType(BuildContext ctx, String typeTag, String subject) {
        if (typeTag == null) return null;
        if (!ctx.getTypeRegistry().isConfigured(typeTag)) {
            ctx.advise(AdvisoryKind.UNCONFIGURED_TYPE, subject == null ? typeTag : subject,
                    "类型未配置，原样输出: " + typeTag);
            return typeTag;
        }
        return ctx.getTypeRegistry().graphType(typeTag);
    }

    /**
     * PropertyValue -> 原始的 Map/List/标量
     */
    static Object toPlain(PropertyValue value) {
        if (value == null) return null;
        switch (value.kind()) {
            case REFERENCE:
            case NESTED_OBJECT:
                Map<String, Object> map = new LinkedHashMap<>();
                ((ObjectValue) value).getEntries().forEach((k, v) -> map.put(k, toPlain(v)));
                return map;
            case LIST:
                List<Object> list = new ArrayList<>();
                for (PropertyValue item : ((ListValue) value).getItems()) {
                    list.add(toPlain(item));
                }
                return list;
            default:
                return ((ScalarValue) value).getValue();
        }
    }
}
