package my.finresolver.app.domain;

/**
 * Head master a metric head was loaded from. Head ids are only unique within a family.
 */
public enum HeadFamily {
	REGULAR,
	RATIO
}
