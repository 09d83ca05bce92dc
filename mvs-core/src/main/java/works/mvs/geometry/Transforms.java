package works.mvs.geometry;

import java.util.ArrayList;
import java.util.List;
import javax.vecmath.Matrix3d;
import javax.vecmath.Matrix4d;
import javax.vecmath.Vector3d;
import org.jetbrains.annotations.Nullable;
import works.mvs.exceptions.InvalidParameterException;
import works.mvs.tree.MvsKind;
import works.mvs.tree.MvsNode;
import works.mvs.tree.NodeParams;

/**
 * Builds the rigid-motion matrices of {@code transform} nodes.
 */
public final class Transforms {
	private Transforms() { }

	public static final double DEFAULT_TOLERANCE = 1e-6;

	public static Matrix4d fromRotationTranslation(@Nullable List<Double> rotation, @Nullable List<Double> translation) {
		return fromRotationTranslation(rotation, translation, DEFAULT_TOLERANCE);
	}

	/**
	 * A rotation followed by a translation.
	 *
	 * @param rotation 9 elements in row-major order; null means identity
	 * @param translation 3 elements; null means zero
	 * @param tolerance maximum deviation of the rotation block from an orthonormal, right-handed matrix
	 * @throws InvalidParameterException naming {@code rotation} or {@code translation} if either is the wrong size,
	 * or naming {@code rotation} if it is not a proper rotation
	 */
	public static Matrix4d fromRotationTranslation(@Nullable List<Double> rotation, @Nullable List<Double> translation, double tolerance) {
		if (rotation != null && rotation.size() != 9) {
			throw new InvalidParameterException("rotation", "'rotation' param for 'transform' node must be array of 9 elements, found " + rotation);
		}
		if (translation != null && translation.size() != 3) {
			throw new InvalidParameterException("translation", "'translation' param for 'transform' node must be array of 3 elements, found " + translation);
		}
		Matrix3d r = new Matrix3d();
		r.setIdentity();
		if (rotation != null) {
			r.set(toArray("rotation", rotation));
		}
		Vector3d t = new Vector3d();
		if (translation != null) {
			t.set(toArray("translation", translation));
		}
		if (!isRotation(r, tolerance)) {
			throw new InvalidParameterException("rotation", "'rotation' param for 'transform' is not a valid rotation matrix: " + rotation);
		}
		return new Matrix4d(r, t, 1.0);
	}

	/**
	 * @return one matrix per {@code transform} child of <code>structureNode</code>, in document order
	 */
	public static List<Matrix4d> forStructure(MvsNode structureNode, double tolerance) {
		List<Matrix4d> result = new ArrayList<>();
		for (MvsNode child : structureNode.children()) {
			if (child.is(MvsKind.TRANSFORM)) {
				NodeParams.Transform params = child.params(NodeParams.Transform.class);
				result.add(fromRotationTranslation(params.rotation(), params.translation(), tolerance));
			}
		}
		return result;
	}

	/**
	 * @return true if <code>matrix</code> has an orthonormal rotation block with determinant +1
	 * and a bottom row of {@code 0 0 0 1}
	 */
	public static boolean isRotationAndTranslation(Matrix4d matrix, double tolerance) {
		Matrix3d r = new Matrix3d();
		matrix.getRotationScale(r);
		return isRotation(r, tolerance)
			&& Math.abs(matrix.m30) <= tolerance
			&& Math.abs(matrix.m31) <= tolerance
			&& Math.abs(matrix.m32) <= tolerance
			&& Math.abs(matrix.m33 - 1.0) <= tolerance;
	}

	static boolean isRotation(Matrix3d r, double tolerance) {
		Matrix3d product = new Matrix3d();
		product.mulTransposeRight(r, r);
		for (int row = 0; row < 3; row++) {
			for (int col = 0; col < 3; col++) {
				double expected = (row == col) ? 1.0 : 0.0;
				if (Math.abs(product.getElement(row, col) - expected) > tolerance) {
					return false;
				}
			}
		}
		return Math.abs(r.determinant() - 1.0) <= tolerance;
	}

	private static double[] toArray(String paramName, List<Double> values) {
		double[] result = new double[values.size()];
		for (int i = 0; i < result.length; i++) {
			Double value = values.get(i);
			if (value == null || !Double.isFinite(value)) {
				throw new InvalidParameterException(paramName, "'" + paramName + "' param for 'transform' has a non-finite element: " + values);
			}
			result[i] = value;
		}
		return result;
	}
}
