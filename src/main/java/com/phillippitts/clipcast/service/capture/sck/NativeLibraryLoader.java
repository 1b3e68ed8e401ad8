package com.phillippitts.clipcast.service.capture.sck;

import com.phillippitts.clipcast.service.capture.Platform;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Locale;
import java.util.Optional;

/**
 * Extracts the bundled bridge dylib for the current macOS architecture to a temp file and
 * loads it. Other platforms get an empty result.
 */
public final class NativeLibraryLoader {

    private static final Logger LOG = LogManager.getLogger(NativeLibraryLoader.class);

    static final String RESOURCE_TEMPLATE = "/natives/darwin/%s/libsck_bridge_swift.dylib";

    private final Platform platform;
    private final String arch;

    private Path loaded;
    private boolean attempted;

    public NativeLibraryLoader() {
        this(Platform.current(), System.getProperty("os.arch", ""));
    }

    NativeLibraryLoader(Platform platform, String arch) {
        this.platform = platform;
        this.arch = arch.toLowerCase(Locale.ROOT);
    }

    /** Classpath resource for this machine's architecture, or empty when unsupported. */
    Optional<String> resourcePath() {
        if (platform != Platform.MAC) {
            return Optional.empty();
        }
        if (arch.contains("aarch64") || arch.contains("arm64")) {
            return Optional.of(String.format(RESOURCE_TEMPLATE, "arm64"));
        }
        if (arch.contains("x86_64") || arch.contains("amd64")) {
            return Optional.of(String.format(RESOURCE_TEMPLATE, "x64"));
        }
        return Optional.empty();
    }

    /**
     * Loads the library once; later calls return the first outcome.
     *
     * @return absolute path of the loaded copy
     */
    public synchronized Optional<Path> load() {
        if (attempted) {
            return Optional.ofNullable(loaded);
        }
        attempted = true;
        Optional<String> resource = resourcePath();
        if (resource.isEmpty()) {
            LOG.debug("No ScreenCaptureKit bridge for platform={} arch={}", platform, arch);
            return Optional.empty();
        }
        try (InputStream in = NativeLibraryLoader.class.getResourceAsStream(resource.get())) {
            if (in == null) {
                LOG.warn("Missing native library resource {}", resource.get());
                return Optional.empty();
            }
            Path tmp = Files.createTempFile("sck_bridge_", ".dylib");
            Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
            try {
                Files.setPosixFilePermissions(tmp, PosixFilePermissions.fromString("rwxr-xr-x"));
            } catch (UnsupportedOperationException e) {
                LOG.debug("Cannot chmod {}: {}", tmp, e.toString());
            }
            tmp.toFile().deleteOnExit();
            Path abs = tmp.toAbsolutePath();
            System.load(abs.toString());
            loaded = abs;
            LOG.info("Loaded ScreenCaptureKit bridge for {}", arch);
            return Optional.of(abs);
        } catch (IOException | UnsatisfiedLinkError | SecurityException e) {
            LOG.warn("Failed to load ScreenCaptureKit bridge: {}", e.toString());
            return Optional.empty();
        }
    }
}
