package net.fortytwo.rewrite.sparql.remap;

import net.fortytwo.rewrite.sparql.PrefixTable;
import org.junit.Before;
import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class IriMinterTest {
    private static final String
            EX = "http://example.org/animals/",
            LOCAL = "http://example.org/local/";

    private IriMapping mapping;

    @Before
    public void setUp() {
        mapping = new IriMapping(PrefixTable.withDefaults().add("ex", EX));
    }

    @Test
    public void testMintedIrisAreSequential() throws Exception {
        IriMinter minter = new IriMinter(mapping, LOCAL, "7");
        assertEquals("07", minter.getDomainCode());

        assertEquals(LOCAL + "07000001", minter.getOrMint(EX + "Dog"));
        assertEquals(LOCAL + "07000002", minter.getOrMint("ex:Cat"));
        assertEquals(2, mapping.size());
    }

    @Test
    public void testExistingRecordIsReused() throws Exception {
        IriMinter minter = new IriMinter(mapping, LOCAL, "7");
        String dog = minter.getOrMint(EX + "Dog");

        assertEquals(dog, minter.getOrMint(EX + "Dog"));
        assertEquals(dog, minter.getOrMint("ex:Dog"));
        assertEquals(1, mapping.size());
    }

    @Test
    public void testUsedIdsAreSkipped() throws Exception {
        mapping.put(EX + "Cat", LOCAL + "07000001");
        mapping.put(EX + "Bird", LOCAL + "07000002");

        IriMinter minter = new IriMinter(mapping, LOCAL, "07");
        assertEquals(LOCAL + "07000003", minter.getOrMint(EX + "Dog"));
    }

    @Test
    public void testPendingRecordsAreCommittedSeparately() throws Exception {
        IriMinter minter = new IriMinter(mapping, LOCAL, "7");
        Map<String, String> pending = new LinkedHashMap<>();

        assertEquals(LOCAL + "07000001", minter.mint(EX + "Dog", pending));
        assertEquals(LOCAL + "07000002", minter.mint(EX + "Cat", pending));
        assertEquals(LOCAL + "07000001", minter.mint(EX + "Dog", pending));
        assertEquals(2, pending.size());
        assertEquals(0, mapping.size());

        minter.commit(pending);
        assertEquals(2, mapping.size());
        assertEquals(LOCAL + "07000002", mapping.get("ex:Cat"));
        assertEquals(LOCAL + "07000003", minter.getOrMint(EX + "Bird"));
    }

    @Test
    public void testDiscardedRecordsFreeTheirIds() throws Exception {
        IriMinter minter = new IriMinter(mapping, LOCAL, "7");
        minter.mint(EX + "Dog", new LinkedHashMap<String, String>());

        assertEquals(LOCAL + "07000001", minter.getOrMint(EX + "Cat"));
    }

    @Test
    public void testIdsAreExhausted() throws Exception {
        IriMinter minter = new IriMinter(mapping, LOCAL, "1", 3);
        minter.getOrMint(EX + "Dog");
        minter.getOrMint(EX + "Cat");

        try {
            minter.getOrMint(EX + "Bird");
            fail("expected ids to run out");
        } catch (IllegalStateException e) {
            // expected
        }
        assertEquals(2, mapping.size());
    }

    @Test
    public void testIsLocal() {
        IriMinter minter = new IriMinter(mapping, LOCAL, "1");
        assertTrue(minter.isLocal(LOCAL + "01000001"));
        assertFalse(minter.isLocal(EX + "Dog"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadDomainCode() {
        new IriMinter(mapping, LOCAL, "100");
    }
}
