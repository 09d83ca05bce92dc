package works.mvs.selector;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.mvs.exceptions.InvalidParameterException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SelectorsTest {

	@Test
	void null_isAll() {
		assertEquals(Selector.ALL, Selectors.fromParams(null));
	}

	@Test
	void string_isStatic() {
		assertEquals(new Selector.Static(StaticSelector.NON_STANDARD), Selectors.fromParams("non-standard"));
	}

	@Test
	void unknownStaticName_throws() {
		assertThrows(InvalidParameterException.class, () -> Selectors.fromParams("everything"));
	}

	@Test
	void object_isOneRow() {
		Selector actual = Selectors.fromParams(Map.of("label_asym_id", "A", "beg_label_seq_id", 10));
		ComponentExpression expected = ComponentExpression.builder().labelAsymId("A").begLabelSeqId(10).build();
		assertEquals(Selector.Expression.of(expected), actual);
	}

	@Test
	void list_isRowsInOrder() {
		Selector actual = Selectors.fromParams(List.of(Map.of("label_asym_id", "A"), Map.of("label_asym_id", "B")));
		assertEquals(Selector.Expression.of(
			ComponentExpression.builder().labelAsymId("A").build(),
			ComponentExpression.builder().labelAsymId("B").build()), actual);
	}

	@Test
	void unknownField_throws() {
		assertThrows(InvalidParameterException.class, () -> Selectors.fromParams(Map.of("chain", "A")));
	}

	@Test
	void wrongFieldType_throws() {
		assertThrows(InvalidParameterException.class, () -> Selectors.fromParams(Map.of("label_seq_id", "ten")));
	}

	@Test
	void toParams_singleRowIsObject() {
		Object params = Selectors.toParams(Selector.Expression.of(ComponentExpression.builder().authSeqId(7).build()));
		assertEquals(Map.of("auth_seq_id", 7), params);
		assertEquals("all", Selectors.toParams(Selector.ALL));
	}
}
