package com.gdin.inspection.lodbook.repository;

import com.gdin.inspection.lodbook.models.Record;
import com.gdin.inspection.lodbook.util.IOUtil;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 读取实体数据文件：JSON 数组，或带 @graph 的 JSON-LD 文档。
 */
@Slf4j
public class RecordLoader {

    @Value
    public static class RecordSource {
        List<Record> records;
        /** 数据文件自带的 @context，没有时为 null */
        Object context;
    }

    public RecordSource load(InputStream is) throws IOException {
        Object data = IOUtil.jsonDeserializeWithNoType(is);
        Object context = null;
        Object graph = data;
        if (data instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) data;
            context = map.get("@context");
            if (map.containsKey("@graph")) {
                graph = map.get("@graph");
            }
        }

        List<Record> records = new ArrayList<>();
        if (graph instanceof List) {
            for (Object item : (List<?>) graph) {
                addRecord(records, item);
            }
        } else {
            addRecord(records, graph);
        }
        log.info("加载实体记录 {} 条", records.size());
        return new RecordSource(records, context);
    }

    private void addRecord(List<Record> records, Object item) {
        if (item instanceof Map) {
            records.add(Record.of((Map<?, ?>) item));
        } else {
            log.warn("忽略非对象记录: {}", item);
        }
    }
}
