package kohonen.som.utils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.correlation.SpearmansCorrelation;
import org.jdom.Document;
import org.jdom.Element;
import org.jdom.JDOMException;
import org.jdom.input.SAXBuilder;
import org.jdom.output.Format;
import org.jdom.output.XMLOutputter;

import kohonen.dist.Dist;
import kohonen.som.grid.Grid2D;
import kohonen.som.grid.GridPos;
import kohonen.som.grid.Neuron;
import kohonen.som.net.SOM;
import kohonen.utils.DataSet;

public class SomUtils {

	public static final int PEARSON_TYPE = 0, SPEARMAN_TYPE = 1;

	private SomUtils() {
	}

	public static Map<GridPos, List<double[]>> getBmuMapping(SOM som, DataSet ds) {
		Map<GridPos, List<double[]>> m = new HashMap<>();
		for( double[] d : ds.getVectors() )
			m.computeIfAbsent(som.test(d).getPos(), k -> new ArrayList<>()).add(d);
		return m;
	}

	// mean distance of samples to their bmu, as seen by the map's distance and adapter
	public static double getMeanQuantError(SOM som, DataSet ds) {
		if( ds.isEmpty() )
			return 0;
		double sum = 0;
		for( double[] d : ds.getVectors() )
			sum += som.test(d).getDistance();
		return sum / ds.size();
	}

	// how often are first and second nearest units in input space not neighbours in output space
	public static double getTopoError(SOM som, DataSet ds) {
		Grid2D grid = som.getGrid();
		if( grid.size() <= 2 || ds.isEmpty() )
			return 0;

		int nAdj = 0;
		for( double[] x : ds.getVectors() ) {
			GridPos firstPos = som.test(x).getPos();
			Set<GridPos> ign = new HashSet<>();
			ign.add(firstPos);
			GridPos secondPos = som.getBmuGetter().getBmu(grid, ign).getPos();

			if( grid.dist(firstPos, secondPos) > 1 )
				nAdj++;
		}
		return (double) nAdj / ds.size();
	}

	// NaN for less than two samples
	public static double getTopoCorrelation(SOM som, DataSet ds, Dist<double[]> dist, int type) {
		if( type != PEARSON_TYPE && type != SPEARMAN_TYPE )
			throw new IllegalArgumentException("Unknown correlation-type! " + type);
		if( ds.size() < 2 )
			return Double.NaN;

		List<double[]> samples = ds.getVectors();
		List<GridPos> bmus = new ArrayList<>(samples.size());
		for( double[] d : samples )
			bmus.add(som.test(d).getPos());

		int size = (samples.size() * (samples.size() - 1)) / 2;
		double[] gridDist = new double[size];
		double[] vectorDist = new double[size];
		int index = 0;
		for( int i = 0; i < samples.size() - 1; i++ ) {
			for( int j = i + 1; j < samples.size(); j++ ) {
				vectorDist[index] = dist.dist(samples.get(i), samples.get(j));
				gridDist[index] = som.getGrid().dist(bmus.get(i), bmus.get(j));
				index++;
			}
		}

		if( type == PEARSON_TYPE )
			return new PearsonsCorrelation().correlation(gridDist, vectorDist);
		else
			return new SpearmansCorrelation().correlation(gridDist, vectorDist);
	}

	public static double[][] getComponentMatrix(Grid2D grid, int idx) {
		double[][] componentMatrix = new double[grid.getXSize()][grid.getYSize()];
		for( Neuron n : grid.getNeurons() )
			componentMatrix[n.getX()][n.getY()] = n.getWeights()[idx];
		return componentMatrix;
	}

	// mean distance of each neuron to its neighbours
	public static double[][] getDMatrix(SOM som) {
		Grid2D grid = som.getGrid();
		Dist<double[]> d = som.getDistance();
		double[][] dmatrix = new double[grid.getXSize()][grid.getYSize()];

		for( Neuron n : grid.getNeurons() ) {
			double height = 0;
			int nbs = 0;
			for( GridPos np : grid.getNeighbours(n.getPos()) ) {
				height += d.dist(n.getWeights(), grid.getNeuron(np).getWeights());
				nbs++;
			}
			dmatrix[n.getX()][n.getY()] = nbs == 0 ? 0 : height / nbs;
		}
		return dmatrix;
	}

	public static void saveGrid(Grid2D grid, OutputStream os) throws IOException {
		Element root = new Element("grid");
		root.setAttribute("xdim", grid.getXSize() + "");
		root.setAttribute("ydim", grid.getYSize() + "");
		Element u = new Element("units");

		for( Neuron n : grid.getNeurons() ) {
			Element p = new Element("unit");
			p.setAttribute("x", n.getX() + "");
			p.setAttribute("y", n.getY() + "");

			Element e = new Element("vector");
			for( double w : n.getWeights() ) {
				Element v = new Element("value");
				v.setText(Double.toString(w));
				e.addContent(v);
			}
			p.addContent(e);
			u.addContent(p);
		}
		root.addContent(u);

		XMLOutputter serializer = new XMLOutputter();
		serializer.setFormat(Format.getPrettyFormat());
		serializer.output(new Document(root), os);
	}

	public static Grid2D loadGrid(InputStream is) throws IOException {
		SAXBuilder builder = new SAXBuilder();
		// no doctypes, thus no external entities
		builder.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
		builder.setExpandEntities(false);

		Document doc;
		try {
			doc = builder.build(is);
		} catch( JDOMException ex ) {
			throw new IOException("Cannot parse grid", ex);
		}

		Element root = doc.getRootElement();
		Element units = root.getChild("units");
		if( units == null )
			throw new IOException("Malformed grid, no units");

		Grid2D grid;
		try {
			grid = new Grid2D(intAttribute(root, "xdim"), intAttribute(root, "ydim"));
		} catch( IllegalArgumentException ex ) {
			throw new IOException("Malformed grid dimensions", ex);
		}

		Set<GridPos> loaded = new HashSet<>();
		int width = -1;
		for( Object o1 : units.getChildren() ) {
			Element e = (Element) o1;
			GridPos p = new GridPos(intAttribute(e, "x"), intAttribute(e, "y"));
			if( !grid.contains(p) )
				throw new IOException("Unit outside of grid: " + p);
			if( !loaded.add(p) )
				throw new IOException("Duplicate unit: " + p);

			Element vector = e.getChild("vector");
			List<?> values = vector == null ? new ArrayList<Object>() : vector.getChildren();
			double[] va = new double[values.size()];
			for( int i = 0; i < va.length; i++ ) {
				String s = ((Element) values.get(i)).getTextTrim();
				try {
					va[i] = Double.parseDouble(s);
				} catch( NumberFormatException ex ) {
					throw new IOException("Malformed value at " + p + ": " + s, ex);
				}
			}
			if( width >= 0 && va.length != width )
				throw new IOException("Unit " + p + " has " + va.length + " values, expected " + width);
			width = va.length;
			grid.getNeuron(p).setWeights(va);
		}

		if( loaded.size() != grid.size() )
			throw new IOException("Grid has " + loaded.size() + " of " + grid.size() + " units");
		return grid;
	}

	private static int intAttribute(Element e, String name) throws IOException {
		String s = e.getAttributeValue(name);
		if( s == null )
			throw new IOException("Missing attribute " + name + " of " + e.getName());
		try {
			return Integer.parseInt(s);
		} catch( NumberFormatException ex ) {
			throw new IOException("Malformed attribute " + name + " of " + e.getName() + ": " + s, ex);
		}
	}
}
