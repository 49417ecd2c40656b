package com.perimeter.sync.service;

import com.perimeter.sync.dto.DeviceIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts controller, line and zone from a device name.
 *
 * The device name is the only source of identity. Names look like
 * {@code "Fence Controller FC-14 Line 0 Zone Z22"}; any text before the
 * {@code FC-} token is ignored.
 */
@Component
@Slf4j
public class DeviceIdentityParser {

    private static final Pattern NAME_PATTERN = Pattern.compile("FC-(\\d+)\\s+Line\\s+(\\d+)\\s+Zone\\s+Z(\\d+)");

    /**
     * Parses a device name.
     *
     * @param name device name, may be null
     * @return the identity with a zone, or empty when the name does not follow the convention
     */
    public Optional<DeviceIdentity> parse(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }

        Matcher matcher = NAME_PATTERN.matcher(name);
        if (!matcher.find()) {
            log.debug("Unparseable device name: {}", name);
            return Optional.empty();
        }

        try {
            return Optional.of(DeviceIdentity.ofZone(
                Integer.parseInt(matcher.group(1)),
                Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3))
            ));
        } catch (NumberFormatException e) {
            log.debug("Device name has out-of-range numbers: {}", name);
            return Optional.empty();
        }
    }
}
