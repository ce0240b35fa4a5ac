package com.github.odict.map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.*;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IndexedOrderedMapTest {

    @Test
    @DisplayName("删除释放的槽位被后续插入复用")
    void testSlotReuse() {
        IndexedOrderedMap<String, Integer> m = new IndexedOrderedMap<>();
        for (int i = 0; i < 5; i++) {
            m.put("k" + i, i);
        }
        assertEquals(5, m.slotsInUse());

        m.remove("k1");
        m.remove("k3");
        m.put("x", 10);
        m.insertFirst("y", 11);

        assertEquals(5, m.slotsInUse(), "空闲槽位应被复用");
        assertEquals(List.of("y", "k0", "k2", "k4", "x"), m.keys());
        m.checkIntegrity();
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 8, 100})
    @DisplayName("超过初始容量时自动扩容")
    void testGrowth(int initialCapacity) {
        IndexedOrderedMap<Integer, Integer> m = new IndexedOrderedMap<>(initialCapacity);
        for (int i = 0; i < 1000; i++) {
            m.put(i, i * i);
        }

        assertEquals(1000, m.size());
        assertTrue(m.capacity() >= 1000);
        assertEquals(999, m.lastKey());
        assertEquals(998 * 998, m.get(998));
        m.checkIntegrity();
    }

    @Test
    @DisplayName("clear 之后从零开始分配槽位")
    void testClearResetsSlots() {
        IndexedOrderedMap<String, Integer> m = new IndexedOrderedMap<>();
        m.put("a", 1);
        m.put("b", 2);
        m.remove("a");
        m.clear();

        assertEquals(0, m.slotsInUse());
        m.put("c", 3);
        assertEquals(1, m.slotsInUse());
        assertEquals(List.of("c"), m.keys());
    }

    @Test
    @DisplayName("swap 交换槽位内容，不分配新槽位")
    void testSwapExchangesSlotPayload() {
        IndexedOrderedMap<String, Integer> m = new IndexedOrderedMap<>();
        m.put("a", 1);
        m.put("b", 2);
        m.put("c", 3);

        m.swap("a", "c");
        m.swap("b", "c");

        assertEquals(List.of("b", "c", "a"), m.keys());
        assertEquals(List.of(2, 3, 1), m.values());
        assertEquals(3, m.slotsInUse());
        assertTrue(m.toDebugString().startsWith("IndexedOrderedMap low level repr head,tail,data: 0, 2, {"));
        m.checkIntegrity();
    }

    @Test
    @DisplayName("流中声明的超大 size 不会按声明值预分配")
    void testOversizedStreamSize() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(new IndexedOrderedMap<String, String>());
        }
        byte[] data = bytes.toByteArray();
        // 末尾是 size 所在的数据块：TC_BLOCKDATA, 长度 4, int 0, TC_ENDBLOCKDATA
        int at = data.length - 7;
        assertArrayEquals(new byte[]{0x77, 4, 0, 0, 0, 0, 0x78}, Arrays.copyOfRange(data, at, data.length));
        data[at + 2] = 0x7f;
        data[at + 3] = (byte) 0xff;
        data[at + 4] = (byte) 0xff;
        data[at + 5] = (byte) 0xff;

        // 声明 Integer.MAX_VALUE 个条目但流中没有任何条目：读到块尾而失败，而不是先分配巨大数组
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(data))) {
            assertThrows(IOException.class, in::readObject);
        }
    }

    @Test
    @DisplayName("反序列化超过预分配上限的 map 时按需扩容")
    void testRestoreBeyondPresize() throws Exception {
        IndexedOrderedMap<Integer, Integer> m = new IndexedOrderedMap<>();
        int n = IndexedOrderedMap.MAX_PRESIZE * 2 + 3;
        for (int i = 0; i < n; i++) {
            m.put(i, -i);
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(m);
        }
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
            @SuppressWarnings("unchecked")
            IndexedOrderedMap<Integer, Integer> restored = (IndexedOrderedMap<Integer, Integer>) in.readObject();
            assertEquals(n, restored.size());
            assertEquals(m, restored);
            assertTrue(restored.capacity() >= n);
            restored.checkIntegrity();
        }
    }

    @Test
    @DisplayName("负的初始容量被拒绝")
    void testNegativeCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new IndexedOrderedMap<String, String>(-1));
    }
}
