package com.depsync.core.deps;

import com.depsync.core.model.ParsedVersion;
import com.vdurmont.semver4j.Semver;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Channel-aware version ordering.
 * <p>
 * A channel is the prerelease part of a version ({@code 0.2.300-integration} is on the
 * {@code integration} channel); a version without one is a production version. Ordering
 * follows semver precedence, so a production version sorts after every prerelease of the
 * same base, and a higher base always wins regardless of channel:
 * <pre>
 *   0.2.299-integration  &lt;  0.2.299  &lt;  0.2.300-integration  &lt;  0.2.300
 * </pre>
 * Build metadata ({@code +...}) is ignored. Versions that are not strict semver are still
 * accepted: the text is split on the first {@code -} into base and channel and missing or
 * non-numeric base parts count as zero.
 */
public class VersionComparator implements Comparator<String> {

    public ParsedVersion parse(String version) {
        String value = withoutBuildMetadata(version == null ? "" : version.trim());
        String channel = channelOf(value);
        try {
            var strict = new Semver(value, Semver.SemverType.STRICT);
            return structured(version, strict.getMajor(), strict.getMinor(), strict.getPatch(), channel);
        } catch (RuntimeException e) {
            return parseLeniently(version, value, channel);
        }
    }

    /**
     * Compares two versions.
     *
     * @return -1, 0 or 1 as {@code a} is older than, equal to, or newer than {@code b}
     */
    @Override
    public int compare(String a, String b) {
        return Integer.signum(parse(a).semver().compareTo(parse(b).semver()));
    }

    /** Whether {@code candidate} is strictly newer than {@code current}. */
    public boolean isNewer(String current, String candidate) {
        return compare(current, candidate) < 0;
    }

    /**
     * Newest version on a channel.
     *
     * @param channel channel to consider, or {@code null} for production versions only
     */
    public Optional<String> findLatest(Collection<String> versions, String channel) {
        return versions.stream()
                .filter(v -> hasChannel(v, channel))
                .max(this);
    }

    /** Versions on a channel ({@code null} = production), newest first. */
    public List<String> getVersionsByChannel(Collection<String> versions, String channel) {
        return versions.stream()
                .filter(v -> hasChannel(v, channel))
                .sorted(this.reversed())
                .toList();
    }

    public String getChannel(String version) {
        return parse(version).channel();
    }

    public boolean hasChannel(String version, String channel) {
        return Objects.equals(parse(version).channel(), channel);
    }

    public String buildVersion(String base, String channel) {
        return channel == null || channel.isEmpty() ? base : base + "-" + channel;
    }

    private ParsedVersion parseLeniently(String original, String value, String channel) {
        int hyphen = value.indexOf('-');
        String base = hyphen < 0 ? value : value.substring(0, hyphen);

        String[] parts = base.split("\\.");
        return structured(original, numberAt(parts, 0), numberAt(parts, 1), numberAt(parts, 2), channel);
    }

    private static ParsedVersion structured(String original, int major, int minor, int patch, String channel) {
        String base = major + "." + minor + "." + patch;
        // semver4j splits prerelease identifiers on '-'; other separators in a channel become dots
        String normalized = channel == null ? base : base + "-" + channel.replaceAll("[^0-9A-Za-z.]", ".");
        return new ParsedVersion(original, base, channel, new Semver(normalized, Semver.SemverType.LOOSE));
    }

    /** Drops {@code +build} metadata; a {@code -} after the {@code +} never starts a channel. */
    private static String withoutBuildMetadata(String value) {
        int plus = value.indexOf('+');
        return plus < 0 ? value : value.substring(0, plus);
    }

    /** Text after the first {@code -} of a version without build metadata; {@code null} when empty. */
    private static String channelOf(String value) {
        int hyphen = value.indexOf('-');
        if (hyphen < 0 || hyphen == value.length() - 1) return null;
        return value.substring(hyphen + 1);
    }

    private static int numberAt(String[] parts, int index) {
        if (index >= parts.length) return 0;
        try {
            return Integer.parseInt(parts[index].trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
