package com.podshift.dependency.model.snapshot;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VolumeMount {

    public enum Type {
        VOLUME,
        BIND
    }

    @Builder.Default
    private Type type = Type.VOLUME;

    private String name;            // Volume name, set for VOLUME mounts
    private String source;          // Host path, set for BIND mounts
    private String destination;     // Path inside the container
    private boolean readOnly;

    /**
     * Key under which consumers of the same storage are grouped.
     * Returns null when the mount does not identify its storage.
     */
    public String sharingKey() {
        if (type == Type.BIND) {
            return source == null || source.isBlank() ? null : "bind:" + source;
        }
        return name == null || name.isBlank() ? null : "volume:" + name;
    }
}
