package com.eh.filemirror.autoupdate.model;

import java.util.Objects;

public class WatchedFileInfo {
    private final Account account;
    private final String repoId;
    private final String pathInRepo;
    private boolean uploading;

    public WatchedFileInfo ( Account account, String repoId, String pathInRepo ) {
        this.account = account;
        this.repoId = repoId;
        this.pathInRepo = pathInRepo;
    }

    public WatchedFileInfo copy ( ) {
        WatchedFileInfo copy = new WatchedFileInfo( account, repoId, pathInRepo );
        copy.uploading = uploading;
        return copy;
    }

    public boolean refersTo ( String repoId, String pathInRepo ) {
        return Objects.equals( this.repoId, repoId ) && Objects.equals( this.pathInRepo, pathInRepo );
    }

    public Account getAccount ( ) {
        return account;
    }

    public String getRepoId ( ) {
        return repoId;
    }

    public String getPathInRepo ( ) {
        return pathInRepo;
    }

    public boolean isUploading ( ) {
        return uploading;
    }

    public void setUploading ( boolean uploading ) {
        this.uploading = uploading;
    }

    @Override
    public String toString ( ) {
        return "WatchedFileInfo{" + "account=" + account + ", repoId='" + repoId + '\'' + ", pathInRepo='" + pathInRepo + '\'' + ", uploading=" + uploading + '}';
    }
}
