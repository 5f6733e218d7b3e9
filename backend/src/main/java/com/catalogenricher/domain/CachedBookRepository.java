package com.catalogenricher.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for the books cache collection.
 */
public interface CachedBookRepository extends MongoRepository<CachedBook, String>, CachedBookRepositoryCustom {

    List<CachedBook> findByIdentifier(String identifier);
}
