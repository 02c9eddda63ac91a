package io.github.drompincen.tabsensei.persistence.repository;

import io.github.drompincen.tabsensei.persistence.document.StoreEntryDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface StoreEntryRepository extends MongoRepository<StoreEntryDocument, String> {
    List<StoreEntryDocument> findByKeyIn(Collection<String> keys);
    List<StoreEntryDocument> findByUpdatedAtGreaterThanEqualOrderByUpdatedAtAsc(Instant since);
}
