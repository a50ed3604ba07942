package com.questrail.dfx.config;

import com.questrail.dfx.model.UserProfile;
import com.questrail.dfx.protocol.ws.observability.DfxObservabilitySink;
import com.questrail.dfx.protocol.ws.observability.NullObservabilitySink;

import java.util.Objects;

/**
 * Aggregated configuration for {@link com.questrail.dfx.client.DfxClient}.
 *
 * <p>Durations of chunks and recordings are in seconds, matching the timing
 * fields sent with each chunk.</p>
 */
public record DfxClientConfig(
    String licenseKey,
    String studyId,
    UserProfile user,
    DfxEndpoints endpoints,
    String deviceName,
    String userProfileId,
    AddDataMethod addDataMethod,
    MeasurementMode measurementMode,
    double chunkDurationSeconds,
    double recordingLengthSeconds,
    DfxTimingPolicy timingPolicy,
    CredentialStore credentialStore,
    DfxObservabilitySink observability
) {
    public DfxClientConfig {
        Objects.requireNonNull(licenseKey, "licenseKey");
        Objects.requireNonNull(studyId, "studyId");
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(endpoints, "endpoints");
        Objects.requireNonNull(deviceName, "deviceName");
        Objects.requireNonNull(userProfileId, "userProfileId");
        Objects.requireNonNull(addDataMethod, "addDataMethod");
        Objects.requireNonNull(measurementMode, "measurementMode");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(credentialStore, "credentialStore");
        Objects.requireNonNull(observability, "observability");

        if (!(chunkDurationSeconds > 0)) {
            throw new IllegalArgumentException("chunkDurationSeconds must be > 0");
        }
        if (recordingLengthSeconds < 0) {
            throw new IllegalArgumentException("recordingLengthSeconds must be >= 0");
        }
        if (chunkDurationSeconds > measurementMode.maxMeasurementLength().toSeconds()) {
            throw new IllegalArgumentException("chunkDurationSeconds exceeds the " + measurementMode
                    + " measurement limit of " + measurementMode.maxMeasurementLength().toSeconds() + "s");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String licenseKey;
        private String studyId;
        private UserProfile user;
        private DfxEndpoints endpoints = DfxServer.PROD.endpoints();
        private String deviceName = "DFX desktop";
        private String userProfileId = "";
        private AddDataMethod addDataMethod = AddDataMethod.REST;
        private MeasurementMode measurementMode = MeasurementMode.DISCRETE;
        private double chunkDurationSeconds = 15;
        private double recordingLengthSeconds = 60;
        private DfxTimingPolicy timingPolicy = DfxTimingPolicy.defaults();
        private CredentialStore credentialStore = new InMemoryCredentialStore();
        private DfxObservabilitySink observability = NullObservabilitySink.INSTANCE;

        public Builder withLicenseKey(String licenseKey) {
            this.licenseKey = licenseKey;
            return this;
        }

        public Builder withStudyId(String studyId) {
            this.studyId = studyId;
            return this;
        }

        public Builder withUser(UserProfile user) {
            this.user = user;
            return this;
        }

        public Builder withServer(DfxServer server) {
            this.endpoints = server.endpoints();
            return this;
        }

        public Builder withEndpoints(DfxEndpoints endpoints) {
            this.endpoints = endpoints;
            return this;
        }

        public Builder withDeviceName(String deviceName) {
            this.deviceName = deviceName;
            return this;
        }

        public Builder withUserProfileId(String userProfileId) {
            this.userProfileId = userProfileId;
            return this;
        }

        public Builder withAddDataMethod(AddDataMethod addDataMethod) {
            this.addDataMethod = addDataMethod;
            return this;
        }

        public Builder withMeasurementMode(MeasurementMode measurementMode) {
            this.measurementMode = measurementMode;
            return this;
        }

        public Builder withChunkDurationSeconds(double chunkDurationSeconds) {
            this.chunkDurationSeconds = chunkDurationSeconds;
            return this;
        }

        public Builder withRecordingLengthSeconds(double recordingLengthSeconds) {
            this.recordingLengthSeconds = recordingLengthSeconds;
            return this;
        }

        public Builder withTimingPolicy(DfxTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withCredentialStore(CredentialStore credentialStore) {
            this.credentialStore = credentialStore;
            return this;
        }

        public Builder withObservability(DfxObservabilitySink observability) {
            this.observability = observability;
            return this;
        }

        public DfxClientConfig build() {
            return new DfxClientConfig(licenseKey, studyId, user, endpoints, deviceName, userProfileId,
                    addDataMethod, measurementMode, chunkDurationSeconds, recordingLengthSeconds,
                    timingPolicy, credentialStore, observability);
        }
    }
}
