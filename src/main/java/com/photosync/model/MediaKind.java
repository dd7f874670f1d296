package com.photosync.model;

public enum MediaKind {
    PHOTO,
    VIDEO
}
