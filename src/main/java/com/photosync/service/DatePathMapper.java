package com.photosync.service;

import com.photosync.model.ItemMetadata;

import java.time.LocalDate;

/**
 * Default layout: year/month/day/ of the item's creation date, e.g. "2019/07/04/".
 * The date is taken in the offset the service reported the timestamp in.
 */
public class DatePathMapper implements PathMapper {

    @Override
    public String directoryFor(ItemMetadata metadata) {
        LocalDate date = metadata.getCreationDateTime().toLocalDate();
        return String.format("%d/%02d/%02d/", date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }
}
