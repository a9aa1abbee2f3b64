package com.juggernaut.shared.presence.core;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

class RecordingListener implements RosterListener {

    final List<String> signedIn = new CopyOnWriteArrayList<>();
    final List<String> signedOut = new CopyOnWriteArrayList<>();

    @Override
    public void onSignedIn(String userId) {
        signedIn.add(userId);
    }

    @Override
    public void onSignedOut(String userId) {
        signedOut.add(userId);
    }
}
