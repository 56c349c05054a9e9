package com.github.micycle1.locationtree;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Geometry primitives over point locations (JTS {@link Coordinate}s, of which
 * only x and y are read) and regions (JTS {@link Envelope}s).
 * <p>
 * Regions are closed: a location lying exactly on a bound is inside. Bounds may
 * be infinite, so a region can describe a half-plane or the whole plane.
 *
 * @author Michael Carleton
 */
public final class Locations {

	private Locations() {
	}

	/**
	 * Coordinate axes, used to order locations.
	 */
	public enum Axis {
		X, Y;

		/**
		 * Returns the value of this axis for the given location.
		 */
		public double of(Coordinate loc) {
			return this == X ? loc.x : loc.y;
		}

		/**
		 * Orders locations ascending by this axis.
		 */
		public Comparator<Coordinate> comparator() {
			return (a, b) -> Double.compare(of(a), of(b));
		}
	}

	/**
	 * Returns a new envelope covering the entire plane.
	 */
	public static Envelope everywhere() {
		return new Envelope(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
	}

	/**
	 * Determines whether two locations have exactly the same x and y (no
	 * tolerance).
	 */
	public static boolean sameLocation(Coordinate a, Coordinate b) {
		return a.x == b.x && a.y == b.y;
	}

	public static double squaredDistance(Coordinate a, Coordinate b) {
		double dx = a.x - b.x;
		double dy = a.y - b.y;
		return dx * dx + dy * dy;
	}

	/**
	 * Euclidean distance between two locations. Differences too large to square
	 * without overflow still give a finite distance.
	 */
	public static double distance(Coordinate a, Coordinate b) {
		return Math.hypot(a.x - b.x, a.y - b.y);
	}

	/**
	 * Computes the mean of the x values and the mean of the y values.
	 *
	 * @param locs a non-empty collection of locations
	 * @return the centroid
	 * @throws IllegalArgumentException if {@code locs} is empty
	 */
	public static Coordinate centroid(Collection<? extends Coordinate> locs) {
		if (locs.isEmpty()) {
			throw new IllegalArgumentException("Cannot compute the centroid of no locations.");
		}
		double sx = 0;
		double sy = 0;
		for (Coordinate loc : locs) {
			sx += loc.x;
			sy += loc.y;
		}
		return new Coordinate(sx / locs.size(), sy / locs.size());
	}

	/**
	 * Determines whether the location lies within the closed region.
	 */
	public static boolean isInRegion(Coordinate loc, Envelope region) {
		return region.covers(loc.x, loc.y);
	}

	/**
	 * Determines whether two closed regions share at least one location. Regions
	 * that only touch along an edge or at a corner overlap.
	 */
	public static boolean overlap(Envelope a, Envelope b) {
		return a.intersects(b);
	}

	/**
	 * Determines whether the minimum distance from a location to any location in
	 * the closed region is strictly more than {@code dist}. The minimum distance is
	 * zero for a location inside the region; otherwise it is measured straight
	 * across the nearest side or diagonally to the nearest corner.
	 * <p>
	 * This never reports {@code true} for a region holding a location that is at
	 * most {@code dist} away, so it is safe to use for pruning.
	 *
	 * @param loc    the reference location
	 * @param region the region, possibly unbounded
	 * @param dist   the distance to compare against, possibly infinite
	 */
	public static boolean distanceMoreThan(Coordinate loc, Envelope region, double dist) {
		double dx = Math.max(0, Math.max(region.getMinX() - loc.x, loc.x - region.getMaxX()));
		double dy = Math.max(0, Math.max(region.getMinY() - loc.y, loc.y - region.getMaxY()));
		if (dx == 0 && dy == 0) {
			return false; // inside
		}
		// same function as distance(), so it never exceeds the distance to a location in the region
		return Math.hypot(dx, dy) > dist;
	}

	/**
	 * Returns the locations that lie within the region, in their input order.
	 */
	public static List<Coordinate> locationsInRegion(Collection<? extends Coordinate> locs, Envelope region) {
		List<Coordinate> inside = new ArrayList<>();
		for (Coordinate loc : locs) {
			if (isInRegion(loc, region)) {
				inside.add(loc);
			}
		}
		return inside;
	}

	/**
	 * Returns the locations sorted ascending along an axis. The sort is stable:
	 * locations with equal values keep their input order.
	 */
	public static List<Coordinate> sortedLocations(Collection<? extends Coordinate> locs, Axis axis) {
		List<Coordinate> sorted = new ArrayList<>(locs);
		sorted.sort(axis.comparator());
		return sorted;
	}

}
