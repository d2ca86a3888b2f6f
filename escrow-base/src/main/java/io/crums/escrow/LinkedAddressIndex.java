/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.escrow;


import static io.crums.escrow.Address.SENTINEL;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-owner, sentinel-terminated, singly linked lists of addresses.
 * 
 * <h2>Structure</h2>
 * <p>
 * Each owner key has its own list, represented as a map of
 * <em>node &rarr; next</em> links. The {@linkplain Address#SENTINEL sentinel}
 * is both the head pointer (its link is the first element) and the
 * terminator (the last element links to it). An owner with no elements is
 * either absent, or has its sentinel linked to itself: the two are treated
 * identically.
 * </p>
 * <h2>Costs</h2>
 * <p>
 * Insertion is at the head, O(1). Removal is by value and traverses the list,
 * O(n). Enumeration is most-recently-inserted-first.
 * </p>
 * <p>Not thread-safe.</p>
 */
public class LinkedAddressIndex {
  
  private final Map<Address, Map<Address, Address>> lists = new HashMap<>();
  
  
  /**
   * Inserts {@code value} at the head of {@code owner}'s list.
   * 
   * @param owner   not null
   * @param value   a {@linkplain Address#isPrincipal() principal} address,
   *                not already linked to {@code owner}
   * 
   * @throws IllegalStateException if {@code value} is already linked
   */
  public void insert(Address owner, Address value) {
    Objects.requireNonNull(owner, "null owner");
    checkValue(value);
    var links = lists.computeIfAbsent(owner, o -> new HashMap<>());
    if (links.containsKey(value))
      throw new IllegalStateException(
          value + " already linked to " + owner);
    
    Address head = links.getOrDefault(SENTINEL, SENTINEL);
    links.put(value, head);
    links.put(SENTINEL, value);
  }
  
  
  /**
   * Removes {@code value} from {@code owner}'s list. Removing a value
   * not in the list is a no-op.
   * 
   * @return {@code true} iff {@code value} was removed
   */
  public boolean remove(Address owner, Address value) {
    return unlink(owner, value) != null;
  }
  
  
  /**
   * Removes {@code value} from {@code owner}'s list and returns its
   * predecessor. The return value, if not {@code null}, may be passed to
   * {@linkplain #relink(Address, Address, Address)} to undo the removal.
   * 
   * @return the predecessor of the removed value ({@linkplain Address#SENTINEL}
   *         if it was the head), or {@code null} if {@code value} was not
   *         in the list
   */
  public Address unlink(Address owner, Address value) {
    Objects.requireNonNull(value, "null value");
    var links = lists.get(Objects.requireNonNull(owner, "null owner"));
    if (links == null || value.equals(SENTINEL) || !links.containsKey(value))
      return null;
    
    Address prev = SENTINEL;
    Address cursor = links.get(SENTINEL);
    while (!cursor.equals(value)) {
      prev = cursor;
      cursor = links.get(cursor);
      if (cursor == null || cursor.equals(SENTINEL))
        throw new IllegalStateException(
            "broken list for owner " + owner + ": " + value + " unreachable");
    }
    links.put(prev, links.remove(value));
    
    if (links.get(SENTINEL).equals(SENTINEL))
      lists.remove(owner);
    return prev;
  }
  
  
  /**
   * Links {@code value} back into {@code owner}'s list, directly after
   * {@code predecessor}. Used to undo an {@linkplain #unlink(Address, Address)
   * unlink}; undoing multiple unlinks must proceed in reverse order.
   * 
   * @param predecessor {@linkplain Address#SENTINEL} (for the head), or an
   *                    address currently in the list
   */
  public void relink(Address owner, Address predecessor, Address value) {
    Objects.requireNonNull(owner, "null owner");
    Objects.requireNonNull(predecessor, "null predecessor");
    checkValue(value);
    boolean atHead = predecessor.equals(SENTINEL);
    if (!atHead && !contains(owner, predecessor))
      throw new IllegalStateException(
          "predecessor " + predecessor + " not linked to " + owner);

    var links = lists.computeIfAbsent(owner, o -> new HashMap<>());
    if (links.containsKey(value))
      throw new IllegalStateException(value + " already linked to " + owner);

    Address next = atHead ?
        links.getOrDefault(SENTINEL, SENTINEL) : links.get(predecessor);

    links.put(value, next);
    links.put(predecessor, value);
  }
  
  
  /**
   * Returns {@code true} iff {@code value} is in {@code owner}'s list.
   */
  public boolean contains(Address owner, Address value) {
    var links = lists.get(owner);
    return links != null && !SENTINEL.equals(value) && links.containsKey(value);
  }
  
  
  /**
   * Returns {@code true} iff {@code owner}'s list is empty.
   */
  public boolean isEmpty(Address owner) {
    var links = lists.get(owner);
    return links == null || links.getOrDefault(SENTINEL, SENTINEL).equals(SENTINEL);
  }
  
  
  /**
   * Returns the number of elements in {@code owner}'s list.
   */
  public int size(Address owner) {
    var links = lists.get(owner);
    return links == null ? 0 : links.size() - 1;
  }
  
  
  /**
   * Returns the elements of {@code owner}'s list, most recently
   * inserted first.
   * 
   * @return read-only snapshot, possibly empty
   */
  public List<Address> enumerate(Address owner) {
    var links = lists.get(owner);
    if (links == null)
      return List.of();
    
    var out = new ArrayList<Address>(links.size());
    for (
        Address cursor = links.getOrDefault(SENTINEL, SENTINEL);
        !cursor.equals(SENTINEL);
        cursor = links.get(cursor)) {
      
      out.add(cursor);
    }
    return Collections.unmodifiableList(out);
  }
  
  
  /**
   * Returns the owners with non-empty lists.
   * 
   * @return read-only snapshot
   */
  public Set<Address> owners() {
    return Set.copyOf(lists.keySet());
  }
  
  
  private void checkValue(Address value) {
    Objects.requireNonNull(value, "null value");
    if (!value.isPrincipal())
      throw new IllegalArgumentException("reserved address: " + value);
  }

}
