package com.eh.filemirror.autoupdate.model;

public record CachedFileUpdatedEvent(String repoId, String pathInRepo) {
}
