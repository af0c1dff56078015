package com.github.llfsm.codec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.llfsm.LLFSMException;
import com.github.llfsm.LLFSMException.Code;
import com.github.llfsm.binding.Filenames;
import com.github.llfsm.layout.Path;
import com.github.llfsm.layout.Point2D;
import com.github.llfsm.layout.Rectangle;
import com.github.llfsm.layout.StateLayout;
import com.github.llfsm.layout.StateLayoutKey;
import com.github.llfsm.layout.TransitionLayout;
import com.github.llfsm.layout.TransitionLayoutKey;

/**
 * Maps state and transition layouts to and from the dictionaries of a {@code Layout.plist}.
 */
final class LayoutPropertyList {
  static final String STATES = "States";
  static final String VERSION = "Version";

  private LayoutPropertyList() {}

  /**
   * The layouts of one state, as read from its dictionary.
   */
  static final class StateEntry {
    private final StateLayout stateLayout;
    private final List<TransitionLayout> transitionLayouts;

    StateEntry(final StateLayout stateLayout, final List<TransitionLayout> transitionLayouts) {
      this.stateLayout = stateLayout;
      this.transitionLayouts = Collections.unmodifiableList(transitionLayouts);
    }

    StateLayout getStateLayout() {
      return stateLayout;
    }

    List<TransitionLayout> getTransitionLayouts() {
      return transitionLayouts;
    }
  }

  static Map<String, Object> stateDictionary(final StateLayout layout,
      final List<TransitionLayout> transitionLayouts) {
    final Map<String, Object> dictionary = new LinkedHashMap<>();
    final Rectangle closed = layout.getClosedLayout();
    final Rectangle open = layout.getOpenLayout();
    dictionary.put(StateLayoutKey.EXPANDED.getKey(), layout.isOpen());
    dictionary.put(StateLayoutKey.POSITION_X.getKey(), closed.getX());
    dictionary.put(StateLayoutKey.POSITION_Y.getKey(), closed.getY());
    dictionary.put(StateLayoutKey.WIDTH.getKey(), closed.getW());
    dictionary.put(StateLayoutKey.HEIGHT.getKey(), closed.getH());
    dictionary.put(StateLayoutKey.EXPANDED_WIDTH.getKey(), open.getW());
    dictionary.put(StateLayoutKey.EXPANDED_HEIGHT.getKey(), open.getH());
    dictionary.put(StateLayoutKey.ON_ENTRY_HEIGHT.getKey(), layout.getOnEntryHeight());
    dictionary.put(StateLayoutKey.ON_EXIT_HEIGHT.getKey(), layout.getOnExitHeight());
    dictionary.put(StateLayoutKey.INTERNAL_HEIGHT.getKey(), layout.getInternalHeight());
    dictionary.put(StateLayoutKey.ON_SUSPEND_HEIGHT.getKey(), layout.getOnSuspendHeight());
    dictionary.put(StateLayoutKey.ON_RESUME_HEIGHT.getKey(), layout.getOnResumeHeight());
    dictionary.put(StateLayoutKey.ZOOMED_ON_ENTRY_HEIGHT.getKey(),
        layout.getZoomedOnEntryHeight());
    dictionary.put(StateLayoutKey.ZOOMED_ON_EXIT_HEIGHT.getKey(), layout.getZoomedOnExitHeight());
    dictionary.put(StateLayoutKey.ZOOMED_INTERNAL_HEIGHT.getKey(),
        layout.getZoomedInternalHeight());
    dictionary.put(StateLayoutKey.ZOOMED_ON_SUSPEND_HEIGHT.getKey(),
        layout.getZoomedOnSuspendHeight());
    dictionary.put(StateLayoutKey.ZOOMED_ON_RESUME_HEIGHT.getKey(),
        layout.getZoomedOnResumeHeight());
    final List<Object> transitions = new ArrayList<>(transitionLayouts.size());
    for (final TransitionLayout transitionLayout : transitionLayouts) {
      transitions.add(transitionDictionary(transitionLayout));
    }
    dictionary.put(TransitionLayoutKey.TRANSITIONS.getKey(), transitions);
    return dictionary;
  }

  /**
   * The bezier path is always written. Newer readers only look at it; the individual points are
   * kept for older ones.
   */
  static Map<String, Object> transitionDictionary(final TransitionLayout layout) {
    final Map<String, Object> dictionary = new LinkedHashMap<>();
    final List<Point2D> points = layout.getPath().getPoints();
    final int n = points.size();
    if (n >= 1) {
      final List<Object> bezier = new ArrayList<>(n);
      for (final Point2D point : points) {
        bezier.add(pair(point));
      }
      dictionary.put(TransitionLayoutKey.BEZIER_PATH.getKey(), bezier);
    }
    if (n > 1) {
      dictionary.put(TransitionLayoutKey.SRC_POINT.getKey(), pair(points.get(0)));
      dictionary.put(TransitionLayoutKey.DST_POINT.getKey(), pair(points.get(n - 1)));
    }
    if (n > 2) {
      dictionary.put(TransitionLayoutKey.CTL_POINT_1.getKey(), pair(points.get(1)));
      dictionary.put(TransitionLayoutKey.CTL_POINT_2.getKey(), pair(points.get(2)));
    }
    if (n > 3) {
      putScalars(dictionary, TransitionLayoutKey.SRC_POINT_X, TransitionLayoutKey.SRC_POINT_Y,
          points.get(0));
      putScalars(dictionary, TransitionLayoutKey.CTL_POINT_1_X,
          TransitionLayoutKey.CTL_POINT_1_Y, points.get(1));
      putScalars(dictionary, TransitionLayoutKey.CTL_POINT_2_X,
          TransitionLayoutKey.CTL_POINT_2_Y, points.get(2));
      putScalars(dictionary, TransitionLayoutKey.DST_POINT_X, TransitionLayoutKey.DST_POINT_Y,
          points.get(n - 1));
    }
    return dictionary;
  }

  private static void putScalars(final Map<String, Object> dictionary,
      final TransitionLayoutKey x, final TransitionLayoutKey y, final Point2D point) {
    dictionary.put(x.getKey(), point.getX());
    dictionary.put(y.getKey(), point.getY());
  }

  private static List<Object> pair(final Point2D point) {
    final List<Object> pair = new ArrayList<>(2);
    pair.add(point.getX());
    pair.add(point.getY());
    return pair;
  }

  /**
   * @return the whole {@code Layout.plist} dictionary: state dictionaries keyed by state name
   */
  static Map<String, Object> layoutDictionary(final Map<String, Map<String, Object>> states) {
    final Map<String, Object> layout = new LinkedHashMap<>();
    layout.put(STATES, new LinkedHashMap<String, Object>(states));
    layout.put(VERSION, Filenames.FILE_VERSION);
    return layout;
  }

  /**
   * Parses a {@code Layout.plist}. States are looked up by name; an index is needed for the grid
   * defaults of missing positions.
   *
   * @throws LLFSMException with {@link Code#MALFORMED_LAYOUT} if the property list is not a
   *         layout dictionary
   */
  static Map<String, Object> stateDictionaries(final byte[] contents) throws LLFSMException {
    final Object root = PropertyList.read(contents);
    if (!(root instanceof Map)) {
      throw new LLFSMException(Code.MALFORMED_LAYOUT, "Layout is not a dictionary");
    }
    final Object states = ((Map<?, ?>) root).get(STATES);
    if (states == null) {
      return Collections.emptyMap();
    }
    if (!(states instanceof Map)) {
      throw new LLFSMException(Code.MALFORMED_LAYOUT, "Layout States is not a dictionary");
    }
    final Map<String, Object> byName = new LinkedHashMap<>();
    for (final Map.Entry<?, ?> entry : ((Map<?, ?>) states).entrySet()) {
      byName.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    return byName;
  }

  /**
   * Reads one state dictionary. Missing values fall back to the grid layout of the state at the
   * given index; a state left at the origin is moved onto the grid too.
   */
  static StateEntry stateEntry(final Object value, final int index) {
    final Map<?, ?> dictionary = value instanceof Map ? (Map<?, ?>) value : Collections.emptyMap();
    final double cw = number(dictionary, StateLayoutKey.WIDTH.getKey(), StateLayout.closedWidth);
    final double ch =
        number(dictionary, StateLayoutKey.HEIGHT.getKey(), StateLayout.closedHeight);
    final double ow =
        number(dictionary, StateLayoutKey.EXPANDED_WIDTH.getKey(), StateLayout.openWidth);
    final double oh =
        number(dictionary, StateLayoutKey.EXPANDED_HEIGHT.getKey(), StateLayout.openHeight);
    final StateLayout grid = StateLayout.grid(index, cw, ch, ow, oh);
    Point2D centre = new Point2D(
        number(dictionary, StateLayoutKey.POSITION_X.getKey(), grid.getClosedLayout().getX()),
        number(dictionary, StateLayoutKey.POSITION_Y.getKey(), grid.getClosedLayout().getY()));
    if (centre.equals(Point2D.ORIGIN)) {
      centre = grid.getClosedLayout().getCentre();
    }
    final double section = oh / 6;
    final StateLayout layout = new StateLayout(Rectangle.centredAt(centre, new Point2D(cw, ch)),
        Rectangle.centredAt(centre, new Point2D(ow, oh)), section);
    final Object expanded = dictionary.get(StateLayoutKey.EXPANDED.getKey());
    layout.setOpen(expanded instanceof Boolean && (Boolean) expanded);
    layout.setOnEntryHeight(number(dictionary, StateLayoutKey.ON_ENTRY_HEIGHT.getKey(), section));
    layout.setOnExitHeight(number(dictionary, StateLayoutKey.ON_EXIT_HEIGHT.getKey(), section));
    layout.setInternalHeight(
        number(dictionary, StateLayoutKey.INTERNAL_HEIGHT.getKey(), section));
    layout.setOnSuspendHeight(
        number(dictionary, StateLayoutKey.ON_SUSPEND_HEIGHT.getKey(), section));
    layout.setOnResumeHeight(
        number(dictionary, StateLayoutKey.ON_RESUME_HEIGHT.getKey(), section));
    layout.setZoomedOnEntryHeight(
        number(dictionary, StateLayoutKey.ZOOMED_ON_ENTRY_HEIGHT.getKey(), section));
    layout.setZoomedOnExitHeight(
        number(dictionary, StateLayoutKey.ZOOMED_ON_EXIT_HEIGHT.getKey(), section));
    layout.setZoomedInternalHeight(
        number(dictionary, StateLayoutKey.ZOOMED_INTERNAL_HEIGHT.getKey(), section));
    layout.setZoomedOnSuspendHeight(
        number(dictionary, StateLayoutKey.ZOOMED_ON_SUSPEND_HEIGHT.getKey(), section));
    layout.setZoomedOnResumeHeight(
        number(dictionary, StateLayoutKey.ZOOMED_ON_RESUME_HEIGHT.getKey(), section));

    final List<TransitionLayout> transitions = new ArrayList<>();
    final Object array = dictionary.get(TransitionLayoutKey.TRANSITIONS.getKey());
    if (array instanceof List) {
      for (final Object transition : (List<?>) array) {
        transitions.add(transitionLayout(
            transition instanceof Map ? (Map<?, ?>) transition : Collections.emptyMap()));
      }
    }
    return new StateEntry(layout, transitions);
  }

  static TransitionLayout transitionLayout(final Map<?, ?> dictionary) {
    final List<Point2D> points = new ArrayList<>();
    final Object bezier = dictionary.get(TransitionLayoutKey.BEZIER_PATH.getKey());
    if (bezier instanceof List && !((List<?>) bezier).isEmpty()) {
      for (final Object element : (List<?>) bezier) {
        final Point2D point = point(element);
        if (point != null) {
          points.add(point);
        }
      }
      return new TransitionLayout(new Path(points));
    }
    addPoint(points, dictionary, TransitionLayoutKey.SRC_POINT, TransitionLayoutKey.SRC_POINT_X,
        TransitionLayoutKey.SRC_POINT_Y);
    addPoint(points, dictionary, TransitionLayoutKey.CTL_POINT_1,
        TransitionLayoutKey.CTL_POINT_1_X, TransitionLayoutKey.CTL_POINT_1_Y);
    addPoint(points, dictionary, TransitionLayoutKey.CTL_POINT_2,
        TransitionLayoutKey.CTL_POINT_2_X, TransitionLayoutKey.CTL_POINT_2_Y);
    addPoint(points, dictionary, TransitionLayoutKey.DST_POINT, TransitionLayoutKey.DST_POINT_X,
        TransitionLayoutKey.DST_POINT_Y);
    return new TransitionLayout(new Path(points));
  }

  private static void addPoint(final List<Point2D> points, final Map<?, ?> dictionary,
      final TransitionLayoutKey pairKey, final TransitionLayoutKey xKey,
      final TransitionLayoutKey yKey) {
    Point2D point = point(dictionary.get(pairKey.getKey()));
    if (point == null) {
      final Object x = dictionary.get(xKey.getKey());
      final Object y = dictionary.get(yKey.getKey());
      if (x instanceof Number && y instanceof Number) {
        point = new Point2D(((Number) x).doubleValue(), ((Number) y).doubleValue());
      }
    }
    if (point != null) {
      points.add(point);
    }
  }

  private static Point2D point(final Object value) {
    if (!(value instanceof List)) {
      return null;
    }
    final List<?> pair = (List<?>) value;
    if (pair.size() < 2 || !(pair.get(0) instanceof Number) || !(pair.get(1) instanceof Number)) {
      return null;
    }
    return new Point2D(((Number) pair.get(0)).doubleValue(), ((Number) pair.get(1)).doubleValue());
  }

  private static double number(final Map<?, ?> dictionary, final String key,
      final double fallback) {
    final Object value = dictionary.get(key);
    return value instanceof Number ? ((Number) value).doubleValue() : fallback;
  }

}
