// ******************************************************************************
//
// Title:       Diffraction Geometry X.
// Description: Diffraction Geometry X - Scan-Varying Geometry Refinement.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2025.
//
// This file is part of Diffraction Geometry X.
//
// Diffraction Geometry X is free software; you can redistribute it and/or
// modify it under the terms of the GNU General Public License version 3 as
// published by the Free Software Foundation.
//
// Diffraction Geometry X is distributed in the hope that it will be useful, but
// WITHOUT ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
// FITNESS FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Diffraction Geometry X; if not, write to the Free Software Foundation, Inc.,
// 59 Temple Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package dgx.refinement.parameterisation;

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class of scan-varying parameterisations. It owns the parameter sets and the smoother, maps
 * between the sets and the optimizer's flat parameter vector, and publishes the state composed by
 * a subclass.
 * <p>
 * A subclass implements {@link #compose(double)} by evaluating each set with
 * {@link #smoothedValue(int, double)}, computing the state and its derivative with respect to each
 * smoothed value, and passing the result to {@link #setComposedState(double, Object, List)}.
 *
 * @param <M> the geometry model type.
 * @param <S> the state type.
 * @author Michael J. Schnieders
 * @since 1.0
 */
public abstract class ScanVaryingModelParameterisation<M, S>
    implements ScanVaryingParameterisation<S> {

  private static final Logger logger =
      Logger.getLogger(ScanVaryingModelParameterisation.class.getName());

  /** The geometry model; owned by the caller and never modified here. */
  protected final M model;
  /** The state at zero parameter values. */
  protected final S initialState;
  /** The smoother shared by all sets. */
  protected final GaussianSmoother smoother;

  private final List<ScanVaryingParameterSet> parameterSets;
  private final ValueWeight[] valueWeights;
  private final int setLength;

  private int[] freeSets;
  private boolean[] fixedSnapshot;

  private boolean composed = false;
  private double composedCoordinate = Double.NaN;
  private S zero;
  private S state;
  private List<S> derivatives;

  /**
   * Constructor for ScanVaryingModelParameterisation.
   *
   * @param model the geometry model.
   * @param initialState the state at zero parameter values.
   * @param parameterSets the parameter sets, all with one value per smoother checkpoint.
   * @param smoother the smoother.
   * @throws IllegalArgumentException if there are no sets or a set length differs from the
   *     number of smoother checkpoints.
   */
  protected ScanVaryingModelParameterisation(M model, S initialState,
      List<ScanVaryingParameterSet> parameterSets, GaussianSmoother smoother) {
    if (parameterSets == null || parameterSets.isEmpty()) {
      throw new IllegalArgumentException(" At least one parameter set is required.");
    }
    setLength = parameterSets.get(0).size();
    for (ScanVaryingParameterSet set : parameterSets) {
      if (set.size() != setLength) {
        throw new IllegalArgumentException(format(
            " Parameter set %s has %d samples; %d are required.",
            set.getNameStem(), set.size(), setLength));
      }
    }
    if (smoother.getNumCheckpoints() != setLength) {
      throw new IllegalArgumentException(format(
          " The smoother has %d checkpoints, but the parameter sets have %d samples.",
          smoother.getNumCheckpoints(), setLength));
    }
    this.model = model;
    this.initialState = initialState;
    this.smoother = smoother;
    this.parameterSets = Collections.unmodifiableList(new ArrayList<>(parameterSets));
    valueWeights = new ValueWeight[parameterSets.size()];
    for (int i = 0; i < valueWeights.length; i++) {
      valueWeights[i] = new ValueWeight(setLength);
    }
    rebuildFreeSets();

    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" %s with %d sets of %d samples.",
          getClass().getSimpleName(), parameterSets.size(), setLength));
    }
  }

  /**
   * The derivative of the state with respect to a parameter that has no influence.
   *
   * @return a new zero state.
   */
  protected abstract S zeroDerivative();

  /** One zero derivative shared by every checkpoint outside a smoothing window. */
  private S sharedZero() {
    if (zero == null) {
      zero = zeroDerivative();
    }
    return zero;
  }

  /**
   * Scale a state derivative.
   *
   * @param derivative derivative of the state with respect to a smoothed value.
   * @param factor the scale factor.
   * @return a new, scaled derivative.
   */
  protected abstract S scaleDerivative(S derivative, double factor);

  /**
   * Copy a state, so that internal results are not exposed to callers.
   *
   * @param s the state.
   * @return a copy.
   */
  protected abstract S copyState(S s);

  /**
   * Evaluate one parameter set at a scan coordinate. The returned object is reused by the next
   * call for the same set.
   *
   * @param setIndex index of the parameter set.
   * @param t the scan coordinate.
   * @return the smoothing result.
   */
  protected ValueWeight smoothedValue(int setIndex, double t) {
    return smoother.valueWeight(t, parameterSets.get(setIndex), valueWeights[setIndex]);
  }

  /**
   * Expand per-set derivatives into per-checkpoint derivatives. The derivative with respect to a
   * checkpoint is the derivative with respect to the smoothed value, times the normalized weight
   * of the checkpoint from the last {@link #smoothedValue(int, double)} of the set.
   *
   * @param setDerivatives the derivative of the state with respect to each smoothed value.
   * @return one derivative per parameter, ordered like flattenValues(false). Entries outside the
   *     smoothing window share one zero instance and must not be modified.
   */
  protected List<S> checkpointDerivatives(List<S> setDerivatives) {
    if (setDerivatives.size() != parameterSets.size()) {
      throw new LengthMismatchException("Set derivatives", parameterSets.size(),
          setDerivatives.size());
    }
    List<S> ret = new ArrayList<>(numTotal());
    for (int k = 0; k < setDerivatives.size(); k++) {
      ValueWeight vw = valueWeights[k];
      S dState = setDerivatives.get(k);
      for (int i = 0; i < setLength; i++) {
        double w = vw.getNormalizedWeight(i);
        ret.add(w == 0.0 ? sharedZero() : scaleDerivative(dState, w));
      }
    }
    return ret;
  }

  /**
   * Publish the result of a compose.
   *
   * @param t the scan coordinate.
   * @param state the state at t.
   * @param derivatives one derivative per parameter, ordered like flattenValues(false).
   */
  protected void setComposedState(double t, S state, List<S> derivatives) {
    if (derivatives.size() != numTotal()) {
      throw new LengthMismatchException("Composed derivatives", numTotal(), derivatives.size());
    }
    this.state = state;
    this.derivatives = new ArrayList<>(derivatives);
    composedCoordinate = t;
    composed = true;
  }

  /** {@inheritDoc} */
  @Override
  public S getState() {
    checkComposed();
    return copyState(state);
  }

  /** {@inheritDoc} */
  @Override
  public List<S> getDerivatives(boolean onlyFree) {
    checkComposed();
    List<S> ret = new ArrayList<>(onlyFree ? numFree() : numTotal());
    for (int k = 0; k < parameterSets.size(); k++) {
      boolean fixed = parameterSets.get(k).isFixed();
      if (fixed && onlyFree) {
        continue;
      }
      for (int i = 0; i < setLength; i++) {
        S d = fixed ? sharedZero() : derivatives.get(k * setLength + i);
        ret.add(copyState(d));
      }
    }
    return ret;
  }

  /** {@inheritDoc} */
  @Override
  public double getComposedCoordinate() {
    checkComposed();
    return composedCoordinate;
  }

  private void checkComposed() {
    if (!composed) {
      throw new IllegalStateException(
          format(" %s has not been composed at a scan coordinate.", getClass().getSimpleName()));
    }
  }

  /** {@inheritDoc} */
  @Override
  public int numFree() {
    return freeSets().length * setLength;
  }

  /** {@inheritDoc} */
  @Override
  public int numTotal() {
    return parameterSets.size() * setLength;
  }

  public int getNumberOfSets() {
    return parameterSets.size();
  }

  /**
   * Number of checkpoints in each set.
   *
   * @return the set length.
   */
  public int getSetLength() {
    return setLength;
  }

  /** {@inheritDoc} */
  @Override
  public double[] flattenValues(boolean onlyFree) {
    double[] ret;
    if (onlyFree) {
      int[] free = freeSets();
      ret = new double[free.length * setLength];
      for (int j = 0; j < free.length; j++) {
        parameterSets.get(free[j]).copyValues(ret, j * setLength);
      }
    } else {
      ret = new double[numTotal()];
      for (int k = 0; k < parameterSets.size(); k++) {
        parameterSets.get(k).copyValues(ret, k * setLength);
      }
    }
    return ret;
  }

  /** {@inheritDoc} */
  @Override
  public List<String> flattenNames(boolean onlyFree) {
    List<String> ret = new ArrayList<>();
    for (ScanVaryingParameterSet set : parameterSets) {
      if (onlyFree && set.isFixed()) {
        continue;
      }
      ret.addAll(set.getNames());
    }
    return ret;
  }

  /** {@inheritDoc} */
  @Override
  public void unflattenValues(double[] values) {
    int[] free = freeSets();
    if (values.length != free.length * setLength) {
      throw new LengthMismatchException("Free parameter vector", free.length * setLength,
          values.length);
    }
    for (int j = 0; j < free.length; j++) {
      int offset = j * setLength;
      parameterSets.get(free[j]).setValues(Arrays.copyOfRange(values, offset, offset + setLength));
    }
  }

  /**
   * Distribute uncertainties of the free parameters over the free sets.
   *
   * @param esds one uncertainty per free parameter.
   * @throws LengthMismatchException if esds.length != numFree().
   */
  public void setParameterEsds(double[] esds) {
    int[] free = freeSets();
    if (esds.length != free.length * setLength) {
      throw new LengthMismatchException("Free parameter esds", free.length * setLength,
          esds.length);
    }
    for (int j = 0; j < free.length; j++) {
      int offset = j * setLength;
      parameterSets.get(free[j]).setEsds(Arrays.copyOfRange(esds, offset, offset + setLength));
    }
  }

  /**
   * The fixed flag of each set.
   *
   * @return a new mask, one entry per set.
   */
  public boolean[] getFixed() {
    boolean[] ret = new boolean[parameterSets.size()];
    for (int k = 0; k < ret.length; k++) {
      ret[k] = parameterSets.get(k).isFixed();
    }
    return ret;
  }

  /**
   * Fix or free each set.
   *
   * @param fixed one flag per set.
   * @throws LengthMismatchException if fixed.length differs from the number of sets.
   */
  public void setFixed(boolean[] fixed) {
    if (fixed.length != parameterSets.size()) {
      throw new LengthMismatchException("Fixed mask", parameterSets.size(), fixed.length);
    }
    for (int k = 0; k < fixed.length; k++) {
      parameterSets.get(k).setFixed(fixed[k]);
    }
  }

  /** Indices of the free sets; rebuilt when a fixed flag has changed since the last build. */
  private int[] freeSets() {
    for (int k = 0; k < fixedSnapshot.length; k++) {
      if (fixedSnapshot[k] != parameterSets.get(k).isFixed()) {
        rebuildFreeSets();
        break;
      }
    }
    return freeSets;
  }

  private void rebuildFreeSets() {
    fixedSnapshot = getFixed();
    int count = 0;
    for (boolean fixed : fixedSnapshot) {
      if (!fixed) {
        count++;
      }
    }
    freeSets = new int[count];
    int j = 0;
    for (int k = 0; k < fixedSnapshot.length; k++) {
      if (!fixedSnapshot[k]) {
        freeSets[j++] = k;
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  public List<ValueWeight> getParameterSetValueWeights(double t, boolean onlyFree) {
    List<ValueWeight> ret = new ArrayList<>();
    for (ScanVaryingParameterSet set : parameterSets) {
      if (onlyFree && set.isFixed()) {
        continue;
      }
      ret.add(smoother.valueWeight(t, set));
    }
    return ret;
  }

  /**
   * Name stems of the parameter sets.
   *
   * @param onlyFree if true, fixed sets are skipped.
   * @return the stems.
   */
  public List<String> getParameterSetNames(boolean onlyFree) {
    List<String> ret = new ArrayList<>();
    for (ScanVaryingParameterSet set : parameterSets) {
      if (onlyFree && set.isFixed()) {
        continue;
      }
      ret.add(set.getNameStem());
    }
    return ret;
  }

  /**
   * Tabulate the smoothed value of every set across a scan range.
   *
   * @param start first scan coordinate.
   * @param end last scan coordinate.
   * @param nSteps number of rows (at least 2).
   * @return the table.
   */
  public String smoothedValueTable(double start, double end, int nSteps) {
    if (nSteps < 2) {
      throw new IllegalArgumentException(format(" At least 2 steps are required (%d).", nSteps));
    }
    StringBuilder sb = new StringBuilder();
    sb.append(format("\n %12s", "Coordinate"));
    for (ScanVaryingParameterSet set : parameterSets) {
      sb.append(format(" %12s", set.getNameStem()));
    }
    sb.append("\n");
    double step = (end - start) / (nSteps - 1);
    for (int n = 0; n < nSteps; n++) {
      double t = start + n * step;
      sb.append(format(" %12.4f", t));
      for (ScanVaryingParameterSet set : parameterSets) {
        sb.append(format(" %12.6f", smoother.valueWeight(t, set).getValue()));
      }
      sb.append("\n");
    }
    return sb.toString();
  }

  public M getModel() {
    return model;
  }

  /**
   * The state at zero parameter values.
   *
   * @return a copy of the initial state.
   */
  public S getInitialState() {
    return copyState(initialState);
  }

  /**
   * The parameter sets, in flattening order.
   *
   * @return an unmodifiable list.
   */
  public List<ScanVaryingParameterSet> getParameterSets() {
    return parameterSets;
  }

  public GaussianSmoother getSmoother() {
    return smoother;
  }
}
