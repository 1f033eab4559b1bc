package com.eh.filemirror.autoupdate.model;

public record DownloadLink(String url, String fileId) {
}
