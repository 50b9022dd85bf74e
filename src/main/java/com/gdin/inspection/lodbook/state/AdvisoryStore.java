package com.gdin.inspection.lodbook.state;

import com.gdin.inspection.lodbook.models.Advisory;
import com.gdin.inspection.lodbook.models.AdvisoryKind;

import java.util.List;

/**
 * 构建期间非致命问题的汇总，实现方需保证线程安全。
 */
public interface AdvisoryStore {

    void record(Advisory advisory);

    /**
     * @return 按记录顺序返回的全部问题
     */
    List<Advisory> list();

    List<Advisory> list(AdvisoryKind kind);

    /**
     * 清空（重新构建前调用）
     */
    void clear();
}
