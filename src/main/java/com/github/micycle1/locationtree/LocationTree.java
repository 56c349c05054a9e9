package com.github.micycle1.locationtree;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Objects;

/**
 * An immutable point-region tree over two-dimensional locations.
 * <p>
 * A tree is built once from a fixed collection of locations by recursively
 * splitting them into four quadrants around a split point (by default the
 * centroid of the locations being split). It is never modified afterwards, so a
 * built tree may be shared and queried by any number of threads.
 * <p>
 * A tree node is one of three kinds:
 * <ul>
 * <li>{@link Kind#EMPTY}: holds no locations;</li>
 * <li>{@link Kind#SINGLE}: holds one location, possibly repeated (see
 * {@link #getMultiplicity()});</li>
 * <li>{@link Kind#SPLIT}: a split point plus four child trees, one per
 * {@link Quadrant}.</li>
 * </ul>
 * Nodes store no bounding rectangle. Queries reconstruct the bounds of each
 * subtree while descending, starting from the whole plane and narrowing at each
 * split with {@link Quadrant#bounds(Envelope, Coordinate)}.
 * <p>
 * Locations handed out by queries are the tree's own coordinates; callers must
 * not modify them.
 *
 * @author Michael Carleton
 */
public final class LocationTree {

	private static final Logger log = LoggerFactory.getLogger(LocationTree.class);

	private static final LocationTree EMPTY = new LocationTree(Kind.EMPTY, null, 0, 0, null, null, null, null, 0);

	private final Kind kind;
	private final Coordinate loc; // SINGLE location, or SPLIT point
	private final int multiplicity;
	private final int rank; // SINGLE only
	private final LocationTree nw, ne, sw, se;
	private final int size;

	private LocationTree(Kind kind, Coordinate loc, int multiplicity, int rank, LocationTree nw, LocationTree ne, LocationTree sw,
			LocationTree se, int size) {
		this.kind = kind;
		this.loc = loc;
		this.multiplicity = multiplicity;
		this.rank = rank;
		this.nw = nw;
		this.ne = ne;
		this.sw = sw;
		this.se = se;
		this.size = size;
	}

	/**
	 * Returns the tree holding no locations.
	 */
	public static LocationTree empty() {
		return EMPTY;
	}

	/**
	 * Returns a tree holding exactly the given location.
	 */
	public static LocationTree single(Coordinate loc) {
		return single(loc, 1);
	}

	/**
	 * Returns a tree holding {@code multiplicity} coincident copies of the given
	 * location.
	 *
	 * @throws IllegalArgumentException if {@code multiplicity} is less than one
	 */
	public static LocationTree single(Coordinate loc, int multiplicity) {
		return single(loc, multiplicity, 0);
	}

	/**
	 * Returns a tree holding {@code multiplicity} coincident copies of the given
	 * location, the first of which was at position {@code rank} of the input.
	 * Nearest-neighbour searches prefer the lower rank between equally distant
	 * locations.
	 *
	 * @throws IllegalArgumentException if {@code multiplicity} is less than one or
	 *                                  {@code rank} is negative
	 */
	public static LocationTree single(Coordinate loc, int multiplicity, int rank) {
		if (multiplicity < 1) {
			throw new IllegalArgumentException("Unexpected multiplicity value: " + multiplicity);
		}
		if (rank < 0) {
			throw new IllegalArgumentException("Unexpected rank value: " + rank);
		}
		return new LocationTree(Kind.SINGLE, new Coordinate(loc.x, loc.y), multiplicity, rank, null, null, null, null, multiplicity);
	}

	/**
	 * Returns a tree split at {@code at}. Each child must only hold locations
	 * belonging to its quadrant, as defined by {@link Quadrant#of(Coordinate, Coordinate)}.
	 */
	public static LocationTree split(Coordinate at, LocationTree nw, LocationTree ne, LocationTree sw, LocationTree se) {
		return new LocationTree(Kind.SPLIT, new Coordinate(at.x, at.y), 0, 0, nw, ne, sw, se, nw.size + ne.size + sw.size + se.size);
	}

	/*
	 * ===================== Building =====================
	 */

	/**
	 * Returns a tree containing exactly the given locations, splitting each group
	 * of locations around its centroid.
	 *
	 * @param locs the locations to index; may be empty and may contain duplicates
	 * @return the tree
	 */
	public static LocationTree buildTree(Collection<? extends Coordinate> locs) {
		return buildTree(locs, SplitStrategy.CENTROID);
	}

	/**
	 * Returns a tree containing exactly the given locations, choosing split points
	 * with the given strategy.
	 * <p>
	 * Every location ends up in exactly one leaf. Coincident locations that can no
	 * longer be told apart become a single leaf whose multiplicity counts them.
	 * Each leaf records the input position of its first location (see
	 * {@link #getRank()}).
	 *
	 * @param locs     the locations to index; may be empty and may contain
	 *                 duplicates
	 * @param strategy how split points are chosen
	 * @return the tree
	 */
	public static LocationTree buildTree(Collection<? extends Coordinate> locs, SplitStrategy strategy) {
		Objects.requireNonNull(locs, "locs");
		Objects.requireNonNull(strategy, "strategy");
		List<BuildItem> items = new ArrayList<>(locs.size());
		for (Coordinate loc : locs) {
			items.add(new BuildItem(loc, items.size()));
		}
		LocationTree tree = build(items, strategy);
		if (log.isDebugEnabled()) {
			log.debug("Built {} tree of {} locations with height {}", strategy, tree.size(), tree.height());
		}
		return tree;
	}

	/**
	 * @param items locations in ascending rank order; partitioning keeps that
	 *              order, so the first item of a group has its lowest rank
	 */
	private static LocationTree build(List<BuildItem> items, SplitStrategy strategy) {
		if (items.isEmpty()) {
			return EMPTY;
		}
		BuildItem first = items.get(0);
		if (allAt(items, first.loc)) {
			return single(first.loc, items.size(), first.rank);
		}

		Coordinate at = splitPoint(items, strategy);
		EnumMap<Quadrant, List<BuildItem>> parts = partition(items, at);
		if (!separates(parts, items.size())) {
			// only possible through rounding or overflow of the mean
			Coordinate fallback = maxCorner(items);
			log.trace("Split point {} does not separate {} locations; splitting at {}", at, items.size(), fallback);
			at = fallback;
			parts = partition(items, at);
		}

		return split(at, build(parts.get(Quadrant.NW), strategy), build(parts.get(Quadrant.NE), strategy),
				build(parts.get(Quadrant.SW), strategy), build(parts.get(Quadrant.SE), strategy));
	}

	private static Coordinate splitPoint(List<BuildItem> items, SplitStrategy strategy) {
		List<Coordinate> locs = new ArrayList<>(items.size());
		for (BuildItem item : items) {
			locs.add(item.loc);
		}
		switch (strategy) {
			case MEDIAN:
				int mid = locs.size() / 2;
				double x = Locations.sortedLocations(locs, Locations.Axis.X).get(mid).x;
				double y = Locations.sortedLocations(locs, Locations.Axis.Y).get(mid).y;
				return new Coordinate(x, y);
			case CENTROID:
			default:
				return Locations.centroid(locs);
		}
	}

	private static EnumMap<Quadrant, List<BuildItem>> partition(List<BuildItem> items, Coordinate at) {
		EnumMap<Quadrant, List<BuildItem>> parts = new EnumMap<>(Quadrant.class);
		for (Quadrant q : Quadrant.values()) {
			parts.put(q, new ArrayList<>());
		}
		for (BuildItem item : items) {
			parts.get(Quadrant.of(item.loc, at)).add(item);
		}
		return parts;
	}

	private static boolean separates(EnumMap<Quadrant, List<BuildItem>> parts, int n) {
		for (List<BuildItem> part : parts.values()) {
			if (part.size() == n) {
				return false;
			}
		}
		return true;
	}

	private static boolean allAt(List<BuildItem> items, Coordinate at) {
		for (BuildItem item : items) {
			if (!Locations.sameLocation(item.loc, at)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * (max x, max y) of the locations. Splitting at this point always separates
	 * locations that are not all coincident.
	 */
	private static Coordinate maxCorner(List<BuildItem> items) {
		double maxX = Double.NEGATIVE_INFINITY;
		double maxY = Double.NEGATIVE_INFINITY;
		for (BuildItem item : items) {
			maxX = Math.max(maxX, item.loc.x);
			maxY = Math.max(maxY, item.loc.y);
		}
		return new Coordinate(maxX, maxY);
	}

	/*
	 * ===================== Region search =====================
	 */

	/**
	 * Returns all locations in this tree that lie within the (closed) region. A
	 * location held with multiplicity <i>m</i> is reported <i>m</i> times. The
	 * order of the result is unspecified.
	 *
	 * @param region the search region
	 * @return the locations found
	 */
	public List<Coordinate> findLocationsInRegion(Envelope region) {
		List<Coordinate> locs = new ArrayList<>();
		addLocationsInRegion(this, region, Locations.everywhere(), locs);
		return locs;
	}

	/**
	 * Adds the locations of {@code tree} within {@code region} to {@code locs}.
	 *
	 * @param bounds a region containing every location of the tree
	 */
	private static void addLocationsInRegion(LocationTree tree, Envelope region, Envelope bounds, List<Coordinate> locs) {
		switch (tree.kind) {
			case EMPTY:
				break;
			case SINGLE:
				if (Locations.isInRegion(tree.loc, region)) {
					for (int i = 0; i < tree.multiplicity; i++) {
						locs.add(tree.loc);
					}
				}
				break;
			case SPLIT:
				if (!Locations.overlap(bounds, region)) {
					return; // no location of this subtree can be within the region
				}
				for (Quadrant q : Quadrant.values()) {
					addLocationsInRegion(tree.getChild(q), region, q.bounds(bounds, tree.loc), locs);
				}
				break;
		}
	}

	/*
	 * ===================== Nearest neighbour =====================
	 */

	/**
	 * Finds the location in this tree closest to any of the reference locations.
	 * When several reference locations are equally close to their nearest tree
	 * location, the earliest of them wins.
	 *
	 * @param refs the reference locations
	 * @return the closest tree location, with its distance to the nearest
	 *         reference location
	 * @throws IllegalArgumentException if {@code refs} is empty or this tree holds
	 *                                  no locations
	 * @throws IllegalStateException    if no distance to a tree location could be
	 *                                  compared, as for a NaN reference location
	 */
	public Nearest findClosestInTree(Collection<? extends Coordinate> refs) {
		if (refs.isEmpty()) {
			throw new IllegalArgumentException("No reference locations passed in.");
		}
		if (kind == Kind.EMPTY) {
			throw new IllegalArgumentException("No locations in the tree to search.");
		}

		ClosestInfo closest = ClosestInfo.NO_INFO;
		for (Coordinate ref : refs) {
			ClosestInfo info = closestInTree(ref, Locations.everywhere(), ClosestInfo.NO_INFO);
			log.trace("Closest to {} is {} after {} distance calculations", ref, info.getLocation(), info.getCalcs());
			if (info.getDistance() < closest.getDistance()) {
				closest = info;
			}
		}
		if (closest.getLocation() == null) {
			throw new IllegalStateException(
					"No closest location found among " + size + " locations for " + refs.size() + " reference locations.");
		}
		return new Nearest(closest.getLocation(), closest.getDistance());
	}

	/**
	 * Finds the closer of the location recorded in {@code closest} and the
	 * location in this tree nearest to {@code ref}.
	 * <p>
	 * This is a branch-and-bound search: a subtree whose bounds are further from
	 * {@code ref} than the best distance so far is skipped. The search is pure;
	 * the returned record is the better of {@code closest} and anything found in
	 * this tree, with its calculation count increased by one for every location
	 * that replaces the best so far. Between equally distant locations
	 * the one with the lower {@linkplain #getRank() rank} wins, so a tree built
	 * from a list agrees with a scan of that list in order.
	 *
	 * @param ref     the reference location
	 * @param bounds  a region containing every location of this tree
	 * @param closest the best result so far ({@link ClosestInfo#NO_INFO} to start
	 *                afresh)
	 * @return the updated result
	 */
	public ClosestInfo closestInTree(Coordinate ref, Envelope bounds, ClosestInfo closest) {
		return closest(this, ref, bounds, closest);
	}

	private static ClosestInfo closest(LocationTree tree, Coordinate ref, Envelope bounds, ClosestInfo closest) {
		if (Locations.distanceMoreThan(ref, bounds, closest.getDistance())) {
			return closest;
		}
		switch (tree.kind) {
			case EMPTY:
				return closest;
			case SINGLE:
				double d = Locations.distance(ref, tree.loc);
				if (d < closest.getDistance() || (d == closest.getDistance() && tree.rank < closest.getRank())) {
					return new ClosestInfo(tree.loc, d, closest.getCalcs() + 1, tree.rank);
				}
				return closest;
			case SPLIT:
			default:
				break;
		}

		// home quadrant first, then the neighbour across the nearer split line,
		// then the other neighbour and finally the diagonal
		Quadrant home = Quadrant.of(ref, tree.loc);
		Quadrant second = home.mirrorX();
		Quadrant third = home.mirrorY();
		if (Math.abs(ref.y - tree.loc.y) < Math.abs(ref.x - tree.loc.x)) {
			second = home.mirrorY();
			third = home.mirrorX();
		}
		Quadrant[] order = { home, second, third, home.opposite() };

		for (Quadrant q : order) {
			closest = closest(tree.getChild(q), ref, q.bounds(bounds, tree.loc), closest);
		}
		return closest;
	}

	/*
	 * ===================== Accessors ====================
	 */

	public Kind getKind() {
		return kind;
	}

	public boolean isEmpty() {
		return kind == Kind.EMPTY;
	}

	/**
	 * Returns the location held by a {@link Kind#SINGLE} tree, or {@code null}
	 * for the other kinds.
	 */
	public Coordinate getLocation() {
		return kind == Kind.SINGLE ? loc : null;
	}

	/**
	 * Returns the number of coincident input locations held by a
	 * {@link Kind#SINGLE} tree (0 for the other kinds).
	 */
	public int getMultiplicity() {
		return multiplicity;
	}

	/**
	 * Returns the input position of the first location held by a
	 * {@link Kind#SINGLE} tree (0 for the other kinds). Ranks take no part in
	 * {@link #equals(Object)}.
	 */
	public int getRank() {
		return rank;
	}

	/**
	 * Returns the split point of a {@link Kind#SPLIT} tree, or {@code null} for
	 * the other kinds.
	 */
	public Coordinate getSplit() {
		return kind == Kind.SPLIT ? loc : null;
	}

	/**
	 * Returns the child covering the given quadrant of a {@link Kind#SPLIT} tree.
	 *
	 * @throws IllegalStateException if this tree is not split
	 */
	public LocationTree getChild(Quadrant quadrant) {
		if (kind != Kind.SPLIT) {
			throw new IllegalStateException("A " + kind + " tree has no children.");
		}
		switch (quadrant) {
			case NW:
				return nw;
			case NE:
				return ne;
			case SW:
				return sw;
			case SE:
			default:
				return se;
		}
	}

	/**
	 * Returns the number of locations held, counting coincident locations
	 * separately.
	 */
	public int size() {
		return size;
	}

	/**
	 * Returns the number of nodes on the longest path from this node to a leaf
	 * (0 for an empty tree).
	 */
	public int height() {
		switch (kind) {
			case EMPTY:
				return 0;
			case SINGLE:
				return 1;
			default:
				int h = 0;
				for (Quadrant q : Quadrant.values()) {
					h = Math.max(h, getChild(q).height());
				}
				return h + 1;
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof LocationTree)) {
			return false;
		}
		LocationTree other = (LocationTree) o;
		return kind == other.kind && multiplicity == other.multiplicity && Objects.equals(loc, other.loc) && Objects.equals(nw, other.nw)
				&& Objects.equals(ne, other.ne) && Objects.equals(sw, other.sw) && Objects.equals(se, other.se);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, loc, multiplicity, nw, ne, sw, se);
	}

	@Override
	public String toString() {
		switch (kind) {
			case EMPTY:
				return "Empty";
			case SINGLE:
				return "Single[" + format(loc) + (multiplicity > 1 ? " x" + multiplicity : "") + "]";
			default:
				return "Split[at=" + format(loc) + ", nw=" + nw + ", ne=" + ne + ", sw=" + sw + ", se=" + se + "]";
		}
	}

	private static String format(Coordinate c) {
		return "(" + c.x + ", " + c.y + ")";
	}

	/* ===================== Supporting Classes ==================== */

	/**
	 * The three shapes of tree node.
	 */
	public enum Kind {
		EMPTY, SINGLE, SPLIT
	}

	/**
	 * How a split point is chosen for a group of locations.
	 */
	public enum SplitStrategy {
		/**
		 * The mean of the x values and of the y values. Usually well balanced, but a
		 * few distant locations skew it away from the bulk of the data.
		 */
		CENTROID,
		/**
		 * The upper median of the x values and of the y values. Costs a sort per
		 * level but resists skewed data.
		 */
		MEDIAN
	}

	/**
	 * The four quadrants around a split point {@code at}. North is towards lower
	 * y and west towards lower x. A location lying on a split line belongs to the
	 * east (x) or south (y) side, so the split point itself lies in {@link #SE}.
	 */
	public enum Quadrant {
		/** x &lt; at.x and y &lt; at.y */
		NW,
		/** x &ge; at.x and y &lt; at.y */
		NE,
		/** x &lt; at.x and y &ge; at.y */
		SW,
		/** x &ge; at.x and y &ge; at.y */
		SE;

		/**
		 * Returns the quadrant of {@code at} that the location belongs to.
		 */
		public static Quadrant of(Coordinate loc, Coordinate at) {
			if (loc.x < at.x) {
				return loc.y < at.y ? NW : SW;
			} else {
				return loc.y < at.y ? NE : SE;
			}
		}

		/**
		 * Narrows the bounds of a split tree to the bounds of this quadrant's child.
		 * The returned envelope is closed, so it also covers the split lines.
		 *
		 * @param bounds bounds of the split tree
		 * @param at     the split point
		 */
		public Envelope bounds(Envelope bounds, Coordinate at) {
			switch (this) {
				case NW:
					return new Envelope(bounds.getMinX(), at.x, bounds.getMinY(), at.y);
				case NE:
					return new Envelope(at.x, bounds.getMaxX(), bounds.getMinY(), at.y);
				case SW:
					return new Envelope(bounds.getMinX(), at.x, at.y, bounds.getMaxY());
				case SE:
				default:
					return new Envelope(at.x, bounds.getMaxX(), at.y, bounds.getMaxY());
			}
		}

		/**
		 * Returns the neighbouring quadrant across the vertical split line.
		 */
		public Quadrant mirrorX() {
			switch (this) {
				case NW:
					return NE;
				case NE:
					return NW;
				case SW:
					return SE;
				case SE:
				default:
					return SW;
			}
		}

		/**
		 * Returns the neighbouring quadrant across the horizontal split line.
		 */
		public Quadrant mirrorY() {
			switch (this) {
				case NW:
					return SW;
				case NE:
					return SE;
				case SW:
					return NW;
				case SE:
				default:
					return NE;
			}
		}

		/**
		 * Returns the diagonally opposite quadrant.
		 */
		public Quadrant opposite() {
			return mirrorX().mirrorY();
		}
	}

	/**
	 * An input location paired with its position in the input.
	 */
	private static final class BuildItem {

		final Coordinate loc;
		final int rank;

		BuildItem(Coordinate loc, int rank) {
			this.loc = loc;
			this.rank = rank;
		}
	}

	/**
	 * The state of a nearest-neighbour search: the closest location found so far
	 * (or {@code null}), its distance (or infinity) and the number of distance
	 * calculations that improved the result.
	 * <p>
	 * The rank of the closest location only breaks distance ties and takes no
	 * part in {@link #equals(Object)}.
	 */
	public static final class ClosestInfo {

		/** No closest location and no calculations performed. */
		public static final ClosestInfo NO_INFO = new ClosestInfo(null, Double.POSITIVE_INFINITY, 0);

		private final Coordinate location;
		private final double distance;
		private final int calcs;
		private final int rank;

		/**
		 * Creates a result whose location loses every distance tie.
		 */
		public ClosestInfo(Coordinate location, double distance, int calcs) {
			this(location, distance, calcs, Integer.MAX_VALUE);
		}

		public ClosestInfo(Coordinate location, double distance, int calcs, int rank) {
			this.location = location;
			this.distance = distance;
			this.calcs = calcs;
			this.rank = rank;
		}

		public Coordinate getLocation() {
			return location;
		}

		public double getDistance() {
			return distance;
		}

		public int getCalcs() {
			return calcs;
		}

		public int getRank() {
			return rank;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) {
				return true;
			}
			if (!(o instanceof ClosestInfo)) {
				return false;
			}
			ClosestInfo other = (ClosestInfo) o;
			return Double.compare(distance, other.distance) == 0 && calcs == other.calcs && Objects.equals(location, other.location);
		}

		@Override
		public int hashCode() {
			return Objects.hash(location, distance, calcs);
		}

		@Override
		public String toString() {
			return "ClosestInfo[loc=" + (location == null ? "none" : format(location)) + ", dist=" + distance + ", calcs=" + calcs + "]";
		}
	}

	/**
	 * A location found by {@link LocationTree#findClosestInTree(Collection)},
	 * paired with its distance to the nearest reference location.
	 */
	public static final class Nearest {

		private final Coordinate location;
		private final double distance;

		public Nearest(Coordinate location, double distance) {
			this.location = location;
			this.distance = distance;
		}

		public Coordinate getLocation() {
			return location;
		}

		public double getDistance() {
			return distance;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) {
				return true;
			}
			if (!(o instanceof Nearest)) {
				return false;
			}
			Nearest other = (Nearest) o;
			return Double.compare(distance, other.distance) == 0 && Objects.equals(location, other.location);
		}

		@Override
		public int hashCode() {
			return Objects.hash(location, distance);
		}

		@Override
		public String toString() {
			return "Nearest[loc=" + (location == null ? "none" : format(location)) + ", dist=" + distance + "]";
		}
	}

}
