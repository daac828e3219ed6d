package at.sv.waqt.astro;

import static at.sv.waqt.astro.LunarAccuracy.FULLY_PERTURBED;
import static at.sv.waqt.astro.LunarAccuracy.KEPLER;
import static at.sv.waqt.astro.LunarAccuracy.PERTURBED;

/**
 * Approximate geocentric position of the moon from its mean orbital elements, optionally corrected by the
 * largest perturbations. Angles are in radians, distances in earth radii.
 */
public final class LunarEphemeris {

    /**
     * The orbital elements below are 1.5 days off their stated epoch; shifting the time compensates.
     */
    private static final double ELEMENT_EPOCH_CORRECTION_DAYS = 1.5;

    private static final double INCLINATION = 0.089804;
    private static final double SEMI_MAJOR_AXIS = 60.2666;
    private static final double ECCENTRICITY = 0.054900;

    private static final int MAX_KEPLER_ITERATIONS = 9;
    private static final double KEPLER_TOLERANCE = 0.000001;

    private LunarEphemeris() {
    }

    public static EquatorialCoordinates position(double unixSeconds, LunarAccuracy accuracy) {
        double t = TimeBase.daysToCenturies(TimeBase.daysSinceJ2000(unixSeconds) + ELEMENT_EPOCH_CORRECTION_DAYS);

        double ascendingNode = 2.183805 - 33.7570736 * t;
        double perigee = 5.551254 + 104.7747539 * t;
        double meanAnomaly = 2.013506 + 8328.69142630 * t;

        double eccentricAnomaly = eccentricAnomaly(meanAnomaly, accuracy);

        double xv = SEMI_MAJOR_AXIS * (Math.cos(eccentricAnomaly) - ECCENTRICITY);
        double yv = SEMI_MAJOR_AXIS * Math.sqrt(1 - ECCENTRICITY * ECCENTRICITY) * Math.sin(eccentricAnomaly);
        double trueAnomaly = Math.atan2(yv, xv);
        double distance = Math.sqrt(xv * xv + yv * yv);

        double argument = trueAnomaly + perigee;
        double xg = distance * (Math.cos(ascendingNode) * Math.cos(argument) -
                                Math.sin(ascendingNode) * Math.sin(argument) * Math.cos(INCLINATION));
        double yg = distance * (Math.sin(ascendingNode) * Math.cos(argument) +
                                Math.cos(ascendingNode) * Math.sin(argument) * Math.cos(INCLINATION));
        double zg = distance * Math.sin(argument) * Math.sin(INCLINATION);

        if (accuracy.includes(PERTURBED)) {
            double latitude = Math.atan2(zg, Math.sqrt(xg * xg + yg * yg));
            double longitude = Math.atan2(yg, xg);

            double sunMeanAnomaly = 4.468863 + 628.3019404 * t;
            double sunLongitude = SolarEphemeris.trueLongitude(t);
            double moonMeanLongitude = ascendingNode + perigee + meanAnomaly;
            double elongation = moonMeanLongitude - sunLongitude;
            double latitudeArgument = moonMeanLongitude - ascendingNode;

            latitude += latitudePerturbation(meanAnomaly, elongation, latitudeArgument, accuracy);
            longitude += longitudePerturbation(meanAnomaly, elongation, latitudeArgument, sunMeanAnomaly, accuracy);
            distance -= 0.58 * Math.cos(meanAnomaly - 2 * elongation) + 0.46 * Math.cos(2 * elongation);

            xg = distance * Math.cos(longitude) * Math.cos(latitude);
            yg = distance * Math.sin(longitude) * Math.cos(latitude);
            zg = distance * Math.sin(latitude);
        }

        double obliquity = SolarEphemeris.obliquity(t);
        double ye = yg * Math.cos(obliquity) - zg * Math.sin(obliquity);
        double ze = yg * Math.sin(obliquity) + zg * Math.cos(obliquity);

        return new EquatorialCoordinates(Math.atan2(ye, xg), Math.atan2(ze, Math.sqrt(xg * xg + ye * ye)), distance);
    }

    /**
     * @return the azimuth of the moon in degrees [0, 360) for an observer at the given latitude and longitude in degrees
     */
    public static double azimuth(double unixSeconds, double latitude, double longitude, LunarAccuracy accuracy) {
        EquatorialCoordinates position = position(unixSeconds, accuracy);
        double hourAngle = SolarEphemeris.hourAngle(unixSeconds, longitude, position.rightAscension());
        return PositionMath.azimuth(hourAngle, position.declination(), Math.toRadians(latitude));
    }

    static double eccentricAnomaly(double meanAnomaly, LunarAccuracy accuracy) {
        double e = meanAnomaly + ECCENTRICITY * Math.sin(meanAnomaly) * (1 + ECCENTRICITY * Math.cos(meanAnomaly));
        if (!accuracy.includes(KEPLER)) {
            return e;
        }
        double delta = 1;
        for (int i = 0; i < MAX_KEPLER_ITERATIONS && Math.abs(delta) > KEPLER_TOLERANCE; i++) {
            delta = (e - ECCENTRICITY * Math.sin(e) - meanAnomaly) / (1 - ECCENTRICITY * Math.cos(e));
            e -= delta;
        }
        return e;
    }

    private static double latitudePerturbation(double m, double d, double f, LunarAccuracy accuracy) {
        double correction = -0.003019 * Math.sin(f - 2 * d);
        if (accuracy.includes(FULLY_PERTURBED)) {
            correction -= 0.00096 * Math.sin(m - f - 2 * d);
            correction -= 0.00080 * Math.sin(m + f - 2 * d);
            correction += 0.00058 * Math.sin(f + 2 * d);
            correction += 0.00030 * Math.sin(2 * m + f);
        }
        return correction;
    }

    private static double longitudePerturbation(double m, double d, double f, double ms, LunarAccuracy accuracy) {
        double correction = -0.02224 * Math.sin(m - 2 * d); // evection
        correction += 0.0115 * Math.sin(2 * d); // variation
        correction -= 0.00325 * Math.sin(ms); // annual equation
        if (accuracy.includes(FULLY_PERTURBED)) {
            correction -= 0.0010 * Math.sin(2 * m - 2 * d);
            correction -= 0.00099 * Math.sin(m - 2 * d + ms);
            correction += 0.00093 * Math.sin(m + 2 * d);
            correction += 0.00080 * Math.sin(2 * d - ms);
            correction += 0.00072 * Math.sin(m - ms);
            correction -= 0.00061 * Math.sin(d);
            correction -= 0.00054 * Math.sin(m + ms);
            correction -= 0.00026 * Math.sin(2 * f - 2 * d);
            correction += 0.00019 * Math.sin(m - 4 * d);
        }
        return correction;
    }
}
