package at.sv.waqt;

import at.sv.waqt.astro.LunarAccuracy;
import at.sv.waqt.config.WaqtConfiguration;
import at.sv.waqt.times.Prayer;
import at.sv.waqt.times.PrayerTimeSet;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

@Command(name = "waqt", version = "0.3.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Calculates the prayer times, qibla and sun and moon azimuth for a location.")
public final class Waqt implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(Waqt.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat",
            defaultValue = "${env:LAT}",
            description = "The latitude of your location in degrees (-90..90). Default: Masjid an-Nabawi.")
    Double latitude;
    @Option(names = "--long",
            defaultValue = "${env:LONG}",
            description = "The longitude of your location in degrees [-180..180). Default: Masjid an-Nabawi.")
    Double longitude;
    @Option(names = "--zone", paramLabel = "<hours>",
            defaultValue = "${env:ZONE}",
            description = "The time zone offset in hours [-13..15], e.g. 1 or 5.5. Default: 3")
    Double timeZone;
    @Option(names = "--method",
            defaultValue = "${env:METHOD:-Karachi}",
            description = "The calculation method: Karachi, ISNA, MWL, Makkah or Egypt. Default: ${DEFAULT-VALUE}")
    String method;
    @Option(names = "--asr-method",
            defaultValue = "${env:ASR_METHOD:-Shafii}",
            description = "The juristic method for asr: Shafii or Hanafi. Default: ${DEFAULT-VALUE}")
    String asrMethod;
    @Option(names = "--adjust", paramLabel = "<minutes>", split = ",",
            defaultValue = "${env:ADJUST}",
            description = "Six comma separated minute adjustments for fajr, shurooq, dhohr, asr, maghrib and isha.")
    double[] adjustments;
    @Option(names = "--time",
            defaultValue = "${env:TIME}",
            description = "The instant to calculate for, as ISO-8601 instant (e.g. 2024-01-01T12:00:00Z) " +
                          "or Unix epoch seconds. Default: now")
    String time;
    @Option(names = "--moon-accuracy", paramLabel = "<level>",
            defaultValue = "${env:MOON_ACCURACY:-2}",
            description = "The accuracy of the moon position from 0 (fastest) to 3 (most accurate). " +
                          "Default: ${DEFAULT-VALUE}")
    int moonAccuracy;
    @Option(names = "--json",
            defaultValue = "${env:JSON:-false}",
            description = "Print the results as JSON. Default: ${DEFAULT-VALUE}")
    boolean json;

    private final Supplier<Instant> currentTime;
    private final WaqtCalculator calculator;
    private final ObjectMapper objectMapper;

    public Waqt() {
        this(Instant::now);
    }

    Waqt(Supplier<Instant> currentTime) {
        this.currentTime = currentTime;
        calculator = new WaqtCalculator();
        objectMapper = new ObjectMapper();
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new Waqt()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        Instant instant = parseTime();
        WaqtConfiguration configuration = WaqtConfiguration.builder()
                                                           .latitude(latitude)
                                                           .longitude(longitude)
                                                           .timeZone(timeZone)
                                                           .method(method)
                                                           .asrMethod(asrMethod)
                                                           .adjustments(adjustments)
                                                           .build();
        LOG.debug("Calculating for {} with {}", instant, configuration);

        PrayerTimeSet times = calculator.prayerTimes(instant, configuration.getLocation(),
                configuration.getTimeZone(), configuration.getSettings());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("day_start", times.dayStart());
        for (Prayer prayer : Prayer.values()) {
            result.put(prayer.getKey(), times.get(prayer));
        }
        result.put("next_midnight", times.nextMidnight());
        result.put("fallback", times.fallback());
        result.put("qibla", calculator.qiblaAzimuth(configuration.getLocation()));
        result.put("sun_azimuth", calculator.sunAzimuth(instant, configuration.getLocation()));
        result.put("moon_azimuth", calculator.moonAzimuth(instant, configuration.getLocation(),
                LunarAccuracy.fromLevel(moonAccuracy)));

        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            out.println(toJson(result));
        } else {
            result.forEach((key, value) -> out.println(formatLine(key, value)));
        }
        out.flush();
    }

    private Instant parseTime() {
        if (time == null || time.isBlank()) {
            return currentTime.get();
        }
        String input = time.trim();
        try {
            if (input.matches("-?[0-9]+")) {
                return Instant.ofEpochSecond(Long.parseLong(input));
            }
            return Instant.parse(input);
        } catch (DateTimeException | NumberFormatException e) {
            throw fail("Invalid --time '" + time + "': expected an ISO-8601 instant or epoch seconds");
        }
    }

    private RuntimeException fail(String msg) {
        if (spec != null) {
            return new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        return new IllegalArgumentException(msg);
    }

    private static String formatLine(String key, Object value) {
        if (value instanceof Instant) {
            Instant instant = (Instant) value;
            return String.format(Locale.ENGLISH, "%-14s %d %s", key, instant.getEpochSecond(), instant);
        }
        if (value instanceof Double) {
            return String.format(Locale.ENGLISH, "%-14s %.4f", key, value);
        }
        return String.format(Locale.ENGLISH, "%-14s %s", key, value);
    }

    private String toJson(Map<String, Object> result) {
        Map<String, Object> serializable = new LinkedHashMap<>();
        result.forEach((key, value) -> serializable.put(key, value instanceof Instant ? value.toString() : value));
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(serializable);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
