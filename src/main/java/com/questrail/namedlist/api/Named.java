package com.questrail.namedlist.api;

/**
 * Named
 * -----------------------------------------------------------------------------
 * The single capability an element must provide to be stored in a
 * {@code NamedList}: it can report its own name.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #name()} is pure and side-effect free</li>
 *   <li>The returned name is non-null and non-empty</li>
 *   <li>The name is stable for as long as the element is held by a collection</li>
 * </ul>
 *
 * The collection calls {@link #name()} whenever it needs the key (insertion,
 * removal, swap, truncation). Changing an element in place so that it reports
 * a different name while it is held breaks the collection's name index. This
 * is a caller obligation; it is not guarded against.
 *
 * <h2>Typical Implementations</h2>
 * <ul>
 *   <li>Small immutable records whose name is a component</li>
 *   <li>{@code enum}s, returning {@code name()} or a label</li>
 * </ul>
 *
 * Example:
 * <pre>{@code
 * record Column(String name, int width) implements Named { }
 * }</pre>
 */
public interface Named
{
    /**
     * Returns this element's name.
     *
     * @return the unique, stable name of this element
     */
    String name();
}
