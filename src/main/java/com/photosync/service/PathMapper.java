package com.photosync.service;

import com.photosync.model.ItemMetadata;

/**
 * Decides the directory, relative to the sync root, an item's content is stored in.
 * Must be a pure function of the metadata: the result is recorded once, when the item is first seen.
 */
@FunctionalInterface
public interface PathMapper {

    String directoryFor(ItemMetadata metadata);
}
