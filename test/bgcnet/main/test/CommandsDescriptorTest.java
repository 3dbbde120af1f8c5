package bgcnet.main.test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import bgcnet.distances.PairwiseDistanceEngine;
import bgcnet.main.Command;
import bgcnet.main.CommandsDescriptor;
import bgcnet.networks.BGCNetworkBuilder;
import junit.framework.TestCase;

public class CommandsDescriptorTest extends TestCase {
	public void testLoadCommands() {
		CommandsDescriptor descriptor = CommandsDescriptor.getInstance();
		assertNotNull(descriptor.getSwVersion());
		Command command = descriptor.getCommand("BGCNetworkBuilder");
		assertNotNull(command);
		assertEquals(BGCNetworkBuilder.class, command.getProgram());
		assertSame(command, descriptor.getCommandByClass(BGCNetworkBuilder.class.getName()));
		assertEquals(String.valueOf(BGCNetworkBuilder.DEF_NEIGHBORHOOD), command.getOption("n").getDefaultValue());
		assertTrue(command.getOption("failFast").isBoolean());
	}

	public void testLoadOptions() {
		BGCNetworkBuilder builder = new BGCNetworkBuilder();
		String [] args = {"-o", "myNet", "-m", "seqdist", "-n", "3", "-v", "0.2", "-wj", "0.5", "-c", "0.1,0.3", "-t", "2", "-failFast", "clusters1.pfd", "clusters2.pfd"};
		int i = CommandsDescriptor.getInstance().loadOptions(builder, args);
		assertEquals(15, i);
		assertEquals("myNet", builder.getOutputPrefix());
		assertEquals(PairwiseDistanceEngine.Mode.SEQDIST, builder.getDistanceMode());
		assertEquals(3, builder.getNeighborhood());
		assertEquals(0.2, builder.getOverlapCutoff(), 0);
		assertEquals(0.5, builder.getJaccardWeight(), 0);
		assertEquals(BGCNetworkBuilder.DEF_DDS_WEIGHT, builder.getDdsWeight(), 0);
		assertEquals("0.1,0.3", builder.getSimilarityCutoffs());
		assertEquals(2, builder.getNumThreads());
		assertTrue(builder.isFailFast());
		assertFalse(builder.isSkipDomainFiles());
		assertEquals("clusters1.pfd", args[i]);
	}

	public void testInvalidOptions() {
		PrintStream err = System.err;
		System.setErr(new PrintStream(new ByteArrayOutputStream()));
		try {
			try {
				CommandsDescriptor.getInstance().loadOptions(new BGCNetworkBuilder(), new String[] {"-unknown", "file.pfd"});
				fail("Unknown option should be rejected");
			} catch (IllegalArgumentException e) {
				assertTrue(e.getMessage().contains("-unknown"));
			}
			try {
				CommandsDescriptor.getInstance().loadOptions(new BGCNetworkBuilder(), new String[] {"-t", "0", "file.pfd"});
				fail("Zero threads should be rejected");
			} catch (IllegalArgumentException e) {
				//Expected
			}
			try {
				CommandsDescriptor.getInstance().loadOptions(new BGCNetworkBuilder(), new String[] {"-n"});
				fail("Missing value should be rejected");
			} catch (IllegalArgumentException e) {
				//Expected
			}
		} finally {
			System.setErr(err);
		}
	}

	public void testPrintHelp() {
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		CommandsDescriptor.getInstance().printHelp(BGCNetworkBuilder.class, new PrintStream(os));
		String help = os.toString();
		assertTrue(help.contains("BGCNetworkBuilder"));
		assertTrue(help.contains("-failFast"));
		assertTrue(help.contains("DOMAIN_HITS_FILE"));
	}
}
