package com.gdin.inspection.lodbook.repository;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.lodbook.models.Record;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 内存实现，加载后不可修改，可在多线程间共享。
 */
@Slf4j
public class InMemoryRecordStore implements RecordStore {

    private final Map<String, Record> byName;

    public InMemoryRecordStore(List<Record> records) {
        Map<String, Record> map = new LinkedHashMap<>();
        if (records != null) {
            for (Record record : records) {
                if (record == null || StrUtil.isBlank(record.getName())) {
                    log.warn("跳过缺少 name 的记录: {}", record);
                    continue;
                }
                // 同名记录以第一条为准
                if (map.putIfAbsent(record.getName(), record) != null) {
                    log.warn("记录 name 重复，忽略后出现的一条: {}", record.getName());
                }
            }
        }
        this.byName = Collections.unmodifiableMap(map);
    }

    @Override
    public Optional<Record> findByName(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(byName.get(name));
    }

    @Override
    public List<Record> listAll() {
        return new ArrayList<>(byName.values());
    }
}
