package com.streamfirst.mosaic.adapters;

import com.streamfirst.mosaic.domain.SessionId;
import com.streamfirst.mosaic.domain.Target;
import com.streamfirst.mosaic.domain.TargetId;
import com.streamfirst.mosaic.ports.TargetRepository;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of TargetRepository for testing and development.
 * Data is lost when the application stops - not suitable for production use.
 */
@Slf4j
public class InMemoryTargetRepository implements TargetRepository {

    private final Map<TargetId, Target> records = new ConcurrentHashMap<>();

    @Override
    public void save(Target target) {
        records.put(target.id(), target);
        log.debug("Saved target record {} ({}x{})", target.id(), target.width(), target.height());
    }

    @Override
    public Optional<Target> findById(TargetId id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public List<Target> findBySession(SessionId sessionId) {
        return records.values().stream()
                .filter(target -> target.sessionId().equals(sessionId))
                .sorted(Comparator.comparing(Target::createdAt))
                .toList();
    }

    @Override
    public boolean delete(TargetId id) {
        return records.remove(id) != null;
    }

    public int size() {
        return records.size();
    }
}
