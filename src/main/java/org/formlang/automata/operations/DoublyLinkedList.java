package org.formlang.automata.operations;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * 双向链表，append 返回节点，节点可以在 O(1) 时间内从链表中删除自己。
 * 用于保存划分中每个等价类的成员。
 */
public class DoublyLinkedList<T> implements Iterable<T> {

    /**
     * 链表节点，只能由所属链表创建。
     */
    public final class Node {
        private final T value;
        private Node previous;
        private Node next;
        private boolean linked = true;

        private Node(T value) {
            this.value = value;
        }

        public T getValue() {
            return value;
        }

        /**
         * 把节点从所属链表中删除。重复删除不会产生任何效果。
         */
        public void delete() {
            if (!linked) {
                return;
            }
            if (previous == null) {
                head = next;
            } else {
                previous.next = next;
            }
            if (next == null) {
                tail = previous;
            } else {
                next.previous = previous;
            }
            previous = null;
            next = null;
            linked = false;
            size--;
        }
    }

    private Node head;
    private Node tail;
    private int size = 0;

    public Node append(T value) {
        Node node = new Node(value);
        if (tail == null) {
            head = node;
        } else {
            tail.next = node;
            node.previous = tail;
        }
        tail = node;
        size++;
        return node;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private Node current = head;

            @Override
            public boolean hasNext() {
                return current != null;
            }

            @Override
            public T next() {
                if (current == null) {
                    throw new NoSuchElementException();
                }
                T value = current.value;
                current = current.next;
                return value;
            }
        };
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (Node node = head; node != null; node = node.next) {
            sb.append(node.value);
            if (node.next != null) {
                sb.append(", ");
            }
        }
        return sb.append("]").toString();
    }
}
