package io.github.drompincen.tabsensei.persistence.repository;

import io.github.drompincen.tabsensei.persistence.document.AlarmDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface AlarmRepository extends MongoRepository<AlarmDocument, String> {
    List<AlarmDocument> findByFireAtLessThanEqualOrderByFireAtAsc(Instant now);
    List<AlarmDocument> findAllByOrderByFireAtAsc();
}
