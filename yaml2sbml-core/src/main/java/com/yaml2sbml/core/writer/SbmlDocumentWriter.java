package com.yaml2sbml.core.writer;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import com.yaml2sbml.core.expression.NumberFormats;
import com.yaml2sbml.core.model.AssignmentRule;
import com.yaml2sbml.core.model.Compartment;
import com.yaml2sbml.core.model.FunctionDefinition;
import com.yaml2sbml.core.model.ModelRule;
import com.yaml2sbml.core.model.Parameter;
import com.yaml2sbml.core.model.RateRule;
import com.yaml2sbml.core.model.Species;
import com.yaml2sbml.core.registry.IdentifierRegistry;

/**
 * Writes an SBML Level 3 Version 1 core document.
 *
 * <p>Lists appear in the order function definitions, compartments, species, parameters,
 * rules; within each list entities keep the order they were added. Empty lists are
 * omitted. Rules of both kinds share one list.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ModelDocumentWriter writer = new SbmlDocumentWriter("lotka_volterra");
 * writer.addAll(model);
 * String sbml = writer.serialize();
 * }</pre>
 */
public class SbmlDocumentWriter implements ModelDocumentWriter {

    private static final Logger log = LoggerFactory.getLogger(SbmlDocumentWriter.class);

    public static final String SBML_NAMESPACE = "http://www.sbml.org/sbml/level3/version1/core";
    static final int LEVEL = 3;
    static final int VERSION = 1;

    private final String modelId;
    private final List<FunctionDefinition> functions = new ArrayList<>();
    private final List<Compartment> compartments = new ArrayList<>();
    private final List<Species> species = new ArrayList<>();
    private final List<Parameter> parameters = new ArrayList<>();
    private final List<ModelRule> rules = new ArrayList<>();

    /**
     * @param modelId model identifier; omitted from the output when null or not a valid SBML id
     */
    public SbmlDocumentWriter(String modelId) {
        this.modelId = modelId;
    }

    @Override
    public void addCompartment(Compartment compartment) {
        compartments.add(compartment);
    }

    @Override
    public void addParameter(Parameter parameter) {
        parameters.add(parameter);
    }

    @Override
    public void addSpecies(Species species) {
        this.species.add(species);
    }

    @Override
    public void addAssignmentRule(AssignmentRule rule) {
        rules.add(rule);
    }

    @Override
    public void addRateRule(RateRule rule) {
        rules.add(rule);
    }

    @Override
    public void addFunctionDefinition(FunctionDefinition function) {
        functions.add(function);
    }

    @Override
    public String serialize() {
        try {
            Document doc = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
            doc.setXmlStandalone(true);
            doc.appendChild(sbml(doc));

            TransformerFactory factory = TransformerFactory.newInstance();
            Transformer transformer = factory.newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");

            StringWriter out = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(out));
            log.debug("Serialized SBML model {} with {} species, {} parameters, {} rules",
                modelId, species.size(), parameters.size(), rules.size());
            return out.toString();
        } catch (ParserConfigurationException | TransformerException e) {
            throw new IllegalStateException("Failed to serialize SBML document", e);
        }
    }

    private Element sbml(Document doc) {
        MathMlRenderer mathMl = new MathMlRenderer(doc);

        Element sbml = doc.createElement("sbml");
        sbml.setAttribute("xmlns", SBML_NAMESPACE);
        sbml.setAttribute("level", String.valueOf(LEVEL));
        sbml.setAttribute("version", String.valueOf(VERSION));

        Element model = doc.createElement("model");
        if (modelId != null && IdentifierRegistry.isValidIdentifier(modelId)) {
            model.setAttribute("id", modelId);
        }
        sbml.appendChild(model);

        if (!functions.isEmpty()) {
            Element list = child(model, "listOfFunctionDefinitions");
            for (FunctionDefinition function : functions) {
                Element element = child(list, "functionDefinition");
                element.setAttribute("id", function.id());
                element.appendChild(mathMl.lambda(function.arguments(), function.body()));
            }
        }

        if (!compartments.isEmpty()) {
            Element list = child(model, "listOfCompartments");
            for (Compartment compartment : compartments) {
                Element element = child(list, "compartment");
                element.setAttribute("id", compartment.id());
                element.setAttribute("size", NumberFormats.format(compartment.size()));
                element.setAttribute("constant", String.valueOf(compartment.constant()));
            }
        }

        if (!species.isEmpty()) {
            Element list = child(model, "listOfSpecies");
            for (Species s : species) {
                Element element = child(list, "species");
                element.setAttribute("id", s.id());
                element.setAttribute("compartment", s.compartment());
                element.setAttribute("initialAmount", NumberFormats.format(s.initialAmount()));
                if (s.substanceUnits() != null) {
                    element.setAttribute("substanceUnits", s.substanceUnits());
                }
                element.setAttribute("hasOnlySubstanceUnits", "false");
                element.setAttribute("boundaryCondition", "false");
                element.setAttribute("constant", "false");
            }
        }

        if (!parameters.isEmpty()) {
            Element list = child(model, "listOfParameters");
            for (Parameter parameter : parameters) {
                Element element = child(list, "parameter");
                element.setAttribute("id", parameter.id());
                if (parameter.name() != null) {
                    element.setAttribute("name", parameter.name());
                }
                if (parameter.value() != null) {
                    element.setAttribute("value", NumberFormats.format(parameter.value()));
                }
                if (parameter.units() != null) {
                    element.setAttribute("units", parameter.units());
                }
                element.setAttribute("constant", String.valueOf(parameter.constant()));
            }
        }

        if (!rules.isEmpty()) {
            Element list = child(model, "listOfRules");
            for (ModelRule rule : rules) {
                Element element = child(list, rule instanceof RateRule ? "rateRule" : "assignmentRule");
                element.setAttribute("variable", rule.variable());
                element.appendChild(mathMl.math(rule.formula()));
            }
        }
        return sbml;
    }

    private static Element child(Element parent, String name) {
        Element element = parent.getOwnerDocument().createElement(name);
        parent.appendChild(element);
        return element;
    }
}
