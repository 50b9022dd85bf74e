package com.gdin.inspection.lodbook.state;

import com.gdin.inspection.lodbook.models.Advisory;
import com.gdin.inspection.lodbook.models.AdvisoryKind;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;

@Slf4j
public class InMemoryAdvisoryStore implements AdvisoryStore {

    private final ConcurrentLinkedQueue<Advisory> advisories = new ConcurrentLinkedQueue<>();

    @Override
    public void record(Advisory advisory) {
        log.warn("[{}] {}: {}", advisory.getKind(), advisory.getSubject(), advisory.getMessage());
        advisories.add(advisory);
    }

    @Override
    public List<Advisory> list() {
        return new ArrayList<>(advisories);
    }

    @Override
    public List<Advisory> list(AdvisoryKind kind) {
        return advisories.stream()
                .filter(a -> a.getKind() == kind)
                .collect(Collectors.toList());
    }

    @Override
    public void clear() {
        advisories.clear();
    }
}
