package com.gdin.inspection.lodbook.repository;

import com.gdin.inspection.lodbook.models.Record;

import java.util.List;
import java.util.Optional;

/**
 * 实体记录的只读查询契约，按 name 精确匹配（区分大小写）。
 */
public interface RecordStore {

    /**
     * @param name 实体名
     * @return 对应记录，未找到时为空
     */
    Optional<Record> findByName(String name);

    /**
     * @return 全部记录，保持数据文件中的顺序
     */
    List<Record> listAll();

    default boolean contains(String name) {
        return findByName(name).isPresent();
    }
}
