package com.phillippitts.clipcast.service.orchestration;

import com.phillippitts.clipcast.domain.CaptureRegion;

import java.util.ArrayList;
import java.util.List;

/**
 * Records commands; every command reports success.
 */
class FakeRecordingController implements RecordingController {

    final List<CaptureRegion> starts = new ArrayList<>();
    int pauses;
    int stops;
    int cancels;

    @Override
    public boolean startRecording(CaptureRegion area) {
        starts.add(area);
        return true;
    }

    @Override
    public boolean pauseRecording() {
        pauses++;
        return true;
    }

    @Override
    public boolean stopRecording() {
        stops++;
        return true;
    }

    @Override
    public boolean cancelRecording() {
        cancels++;
        return true;
    }

    @Override
    public boolean isRecording() {
        return false;
    }
}
