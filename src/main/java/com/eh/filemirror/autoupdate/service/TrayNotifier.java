package com.eh.filemirror.autoupdate.service;

public interface TrayNotifier {

    void showMessage ( String title, String message, String repoId );
}
